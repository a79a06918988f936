package dev.kyriji.bmcnetwork.providers.hwcloud;

import dev.kyriji.bmcnetwork.config.ConfigNormalizer;
import dev.kyriji.bmcnetwork.config.NetworkConfig;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.factories.BackingServiceFactory;
import dev.kyriji.bmcnetwork.network.ServiceContext;
import dev.kyriji.bmcnetwork.network.TestPods;
import dev.kyriji.bmcnetwork.objects.Allocation;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkConfParam;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.kyriji.bmcnetwork.network.TestPods.param;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HwCloudElbAdapterTest {
	private final HwCloudElbAdapter adapter = new HwCloudElbAdapter(options(Map.of()));
	private final BackingServiceFactory factory = new BackingServiceFactory();

	@Test
	void defaultAnnotationsPinTheServiceToTheElb() {
		// When
		Service service = factory.buildService(adapter, context(param("ElbIds", "elb-1"), param("PortProtocols", "7777")));

		// Then
		assertThat(service.getSpec().getType()).isEqualTo("LoadBalancer");
		assertThat(service.getSpec().getExternalTrafficPolicy()).isEqualTo("Local");
		assertThat(service.getSpec().getPublishNotReadyAddresses()).isFalse();
		assertThat(service.getMetadata().getAnnotations())
				.containsEntry(HwCloudElbAdapter.ELB_ID_ANNOTATION, "elb-1")
				.containsEntry("kubernetes.io/elb.class", "dedicated")
				.containsEntry("kubernetes.io/elb.lb-algorithm", "ROUND_ROBIN")
				.containsEntry("kubernetes.io/elb.session-affinity-flag", "off")
				.containsEntry("kubernetes.io/elb.health-check-flag", "on");
	}

	@Test
	void configuredOptionsOverrideTheDefaults() {
		// When
		Service service = factory.buildService(adapter, context(
				param("ElbIds", "elb-1"),
				param("PortProtocols", "7777"),
				param("ElbLbAlgorithm", "LEAST_CONNECTIONS"),
				param("LBHealthCheckFlag", "off"),
				param("LBHealthCheckOption", "{\"delay\": 5, \"timeout\": 10}"),
				param("ExternalTrafficPolicyType", "Cluster"),
				param("PublishNotReadyAddresses", "true")));

		// Then
		assertThat(service.getMetadata().getAnnotations())
				.containsEntry("kubernetes.io/elb.lb-algorithm", "LEAST_CONNECTIONS")
				.containsEntry("kubernetes.io/elb.health-check-flag", "off")
				.containsEntry("kubernetes.io/elb.health-check-option", "{\"delay\":5,\"timeout\":10}");
		assertThat(service.getSpec().getExternalTrafficPolicy()).isEqualTo("Cluster");
		assertThat(service.getSpec().getPublishNotReadyAddresses()).isTrue();
	}

	@Test
	void connectionLimitOnlyAppliesToSharedLoadBalancers() {
		// When
		Map<String, String> dedicated = adapter.getServiceAnnotations(context(
				param("ElbIds", "elb-1"),
				param("PortProtocols", "7777"),
				param("ElbConnLimit", "1000")));
		Map<String, String> shared = adapter.getServiceAnnotations(context(
				param("ElbIds", "elb-1"),
				param("PortProtocols", "7777"),
				param("ElbClass", "union"),
				param("ElbConnLimit", "1000")));

		// Then
		assertThat(dedicated).doesNotContainKey("kubernetes.io/elb.connection-limit");
		assertThat(shared)
				.containsEntry("kubernetes.io/elb.class", "union")
				.containsEntry("kubernetes.io/elb.connection-limit", "1000");
	}

	@Test
	void defaultClassComesFromTheEnvironment() {
		HwCloudElbAdapter shared = new HwCloudElbAdapter(options(Map.of("HWCLOUD_ELB_CLASS", "union")));

		Map<String, String> annotations = shared.getServiceAnnotations(context(param("ElbIds", "elb-1"), param("PortProtocols", "7777")));

		assertThat(annotations).containsEntry("kubernetes.io/elb.class", "union");
	}

	@Test
	void externalAddressAppearsWithTheIngressIp() {
		// Given
		Service pending = factory.buildService(adapter, context(param("ElbIds", "elb-1"), param("PortProtocols", "7777")));
		Service ready = new ServiceBuilder(pending)
				.withNewStatus()
					.withNewLoadBalancer()
						.addNewIngress().withIp("198.51.100.4").endIngress()
					.endLoadBalancer()
				.endStatus()
				.build();

		// When
		List<NetworkAddress> none = adapter.resolveExternalAddresses(null, pod(), pending);
		List<NetworkAddress> addresses = adapter.resolveExternalAddresses(null, pod(), ready);

		// Then
		assertThat(none).isEmpty();
		assertThat(addresses).singleElement().satisfies(address -> {
			assertThat(address.getIp()).isEqualTo("198.51.100.4");
			assertThat(address.getPorts()).extracting(NetworkPort::getPort).containsExactly(30001);
		});
	}

	@Test
	void rangeAboveTheListenerLimitIsRejected() {
		PluginOptions wide = new PluginOptions(HwCloudElbAdapter.OPTIONS_PREFIX, true, 30000, 30300, List.of(), Map.of());

		assertThatThrownBy(() -> new HwCloudElbAdapter(wide))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static PluginOptions options(Map<String, String> env) {
		return new PluginOptions(HwCloudElbAdapter.OPTIONS_PREFIX, true, 30000, 30199, List.of(), env);
	}

	private Pod pod() {
		return TestPods.pod("games", "pod-0", HwCloudElbAdapter.NAME);
	}

	private ServiceContext context(NetworkConfParam... params) {
		NetworkConfig config = new ConfigNormalizer(HwCloudElbAdapter.NAME, adapter.getConfigSchema()).parse(List.of(params));
		Allocation allocation = new Allocation("games/pod-0", "games/pod-0", "elb-1", List.of(30001));
		return new ServiceContext(pod(), config, allocation, config.hash(), "games/pod-0", List.of());
	}
}
