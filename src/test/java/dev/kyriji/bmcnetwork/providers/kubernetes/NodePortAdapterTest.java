package dev.kyriji.bmcnetwork.providers.kubernetes;

import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.enums.PluginErrorType;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.network.LoadBalancerPlugin;
import dev.kyriji.bmcnetwork.network.TestPods;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.kyriji.bmcnetwork.network.TestPods.param;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnableKubernetesMockClient(crud = true)
class NodePortAdapterTest {
	private static final String NS = "games";

	KubernetesClient client;

	private NodePortAdapter adapter;
	private LoadBalancerPlugin plugin;

	@BeforeEach
	void setUp() {
		adapter = new NodePortAdapter(new PluginOptions(NodePortAdapter.OPTIONS_PREFIX, true, 30000, 32767, List.of(), Map.of()));
		plugin = new LoadBalancerPlugin(adapter);
		plugin.init(client);
	}

	@Test
	void servicePortsMirrorTheTargetPorts() {
		// When
		plugin.onPodUpdated(plugin.onPodAdded(TestPods.pod(NS, "pod-0", NodePortAdapter.NAME, param("PortProtocols", "7777,7778/UDP"))));

		// Then
		Service service = client.services().inNamespace(NS).withName("pod-0").get();
		assertThat(service.getSpec().getType()).isEqualTo("NodePort");
		assertThat(service.getSpec().getPorts()).extracting(ServicePort::getPort).containsExactly(7777, 7778);
		assertThat(plugin.getIndex()).isNull();
	}

	@Test
	void missingPortProtocolsIsAParameterError() {
		Pod pod = plugin.onPodAdded(TestPods.pod(NS, "pod-0", NodePortAdapter.NAME));

		assertThatThrownBy(() -> plugin.onPodUpdated(pod))
				.isInstanceOf(PluginException.class)
				.satisfies(e -> assertThat(((PluginException) e).getType()).isEqualTo(PluginErrorType.PARAMETER));
	}

	@Test
	void externalAddressPrefersTheNodeExternalIp() {
		// Given
		node("node-1", "InternalIP", "10.1.0.5", "ExternalIP", "203.0.113.20");

		// When
		List<NetworkAddress> addresses = adapter.resolveExternalAddresses(client, pod(), service(31001));

		// Then
		assertThat(addresses).singleElement().satisfies(address -> {
			assertThat(address.getIp()).isEqualTo("203.0.113.20");
			assertThat(address.getPorts()).extracting(NetworkPort::getPort).containsExactly(31001);
		});
	}

	@Test
	void internalIpIsUsedWithoutAnExternalOne() {
		node("node-1", "Hostname", "node-1", "InternalIP", "10.1.0.5");

		assertThat(adapter.resolveExternalAddresses(client, pod(), service(31001)))
				.singleElement()
				.extracting(NetworkAddress::getIp)
				.isEqualTo("10.1.0.5");
	}

	@Test
	void notReadyUntilEveryNodePortIsAssigned() {
		node("node-1", "InternalIP", "10.1.0.5");

		assertThat(adapter.resolveExternalAddresses(client, pod(), service(0))).isEmpty();
	}

	@Test
	void notReadyWithoutTheNode() {
		assertThat(adapter.resolveExternalAddresses(client, pod(), service(31001))).isEmpty();
	}

	@Test
	void readyPodPublishesNodeAddress() {
		// Given
		node("node-1", "ExternalIP", "203.0.113.20");
		Pod first = plugin.onPodUpdated(plugin.onPodAdded(TestPods.pod(NS, "pod-0", NodePortAdapter.NAME, param("PortProtocols", "7777"))));
		client.services().inNamespace(NS).withName("pod-0").edit(svc -> new ServiceBuilder(svc)
				.editSpec()
					.editFirstPort().withNodePort(31500).endPort()
				.endSpec()
				.build());

		// When
		Pod result = plugin.onPodUpdated(first);

		// Then
		NetworkStatus status = TestPods.status(result);
		assertThat(status.getCurrentNetworkState()).isEqualTo(NetworkState.READY);
		assertThat(status.getExternalAddresses()).singleElement().satisfies(address -> {
			assertThat(address.getIp()).isEqualTo("203.0.113.20");
			assertThat(address.getPorts()).extracting(NetworkPort::getPort).containsExactly(31500);
		});
	}

	private Pod pod() {
		return TestPods.pod(NS, "pod-0", NodePortAdapter.NAME, param("PortProtocols", "7777"));
	}

	private Service service(int nodePort) {
		return new ServiceBuilder()
				.withNewMetadata().withName("pod-0").withNamespace(NS).endMetadata()
				.withNewSpec()
					.withType("NodePort")
					.addNewPort().withName("7777-tcp").withProtocol("TCP").withPort(7777).withNodePort(nodePort).endPort()
				.endSpec()
				.build();
	}

	private void node(String name, String... typeAndAddress) {
		NodeBuilder builder = new NodeBuilder()
				.withNewMetadata().withName(name).endMetadata()
				.withNewStatus().endStatus();
		for (int i = 0; i < typeAndAddress.length; i += 2) {
			builder.editStatus()
					.addNewAddress().withType(typeAndAddress[i]).withAddress(typeAndAddress[i + 1]).endAddress()
					.endStatus();
		}
		client.nodes().resource(builder.build()).create();
	}
}
