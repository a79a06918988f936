package dev.kyriji.bmcnetwork.controller;

import dev.kyriji.bmcnetwork.controllers.ProviderManager;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.network.TestPods;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import dev.kyriji.bmcnetwork.providers.tencent.TencentClbPlugin;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static dev.kyriji.bmcnetwork.network.TestPods.param;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@EnableKubernetesMockClient(crud = true)
class InformerManagerTest {
	private static final String NS = "games";

	KubernetesClient client;

	private ReconciliationQueue queue;
	private InformerManager manager;

	@AfterEach
	void tearDown() {
		if (manager != null) manager.shutdown();
		if (queue != null) queue.shutdown();
	}

	@Test
	void onlyPodsWithANetworkTypeAreWatched() {
		Pod plain = new PodBuilder().withNewMetadata().withName("plain").withNamespace(NS).endMetadata().build();
		Pod blank = new PodBuilder(plain).editMetadata().addToAnnotations(NetworkLabel.NETWORK_TYPE.getLabel(), "").endMetadata().build();

		assertThat(InformerManager.hasNetwork(plain)).isFalse();
		assertThat(InformerManager.hasNetwork(blank)).isFalse();
		assertThat(InformerManager.hasNetwork(TestPods.pod(NS, "pod-0", TencentClbPlugin.NAME))).isTrue();
	}

	@Test
	void newPodIsReconciledByTheWorkers() {
		// Given
		ProviderManager providers = new ProviderManager();
		providers.register(new TencentClbPlugin());
		queue = new ReconciliationQueue();
		manager = new InformerManager(client, queue, new PodNetworkReconciler(client, providers, 100, 1000), 2, 60_000);
		manager.setupInformers();
		manager.start();

		// When
		client.pods().inNamespace(NS).resource(TestPods.pod(NS, "pod-0", TencentClbPlugin.NAME, param("PortProtocols", "7777"))).create();

		// Then
		await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
			Pod pod = client.pods().inNamespace(NS).withName("pod-0").get();
			assertThat(pod.getMetadata().getAnnotations()).containsKey(TencentClbPlugin.PORT_MAPPING);
			NetworkStatus status = TestPods.status(pod);
			assertThat(status.getCurrentNetworkState()).isEqualTo(NetworkState.WAITING);
		});
	}
}
