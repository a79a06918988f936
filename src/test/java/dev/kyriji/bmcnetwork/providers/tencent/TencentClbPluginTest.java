package dev.kyriji.bmcnetwork.providers.tencent;

import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.enums.PluginErrorType;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.network.TestPods;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import org.junit.jupiter.api.Test;

import static dev.kyriji.bmcnetwork.network.TestPods.param;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TencentClbPluginTest {
	private final TencentClbPlugin plugin = new TencentClbPlugin();

	@Test
	void firstPassWaitsForTheCloudController() {
		// When
		Pod result = plugin.onPodAdded(clbPod());

		// Then
		NetworkStatus status = TestPods.status(result);
		assertThat(status.getCurrentNetworkState()).isEqualTo(NetworkState.WAITING);
		assertThat(status.getNetworkType()).isEqualTo(TencentClbPlugin.NAME);
		assertThat(result.getMetadata().getAnnotations()).doesNotContainKey(TencentClbPlugin.PORT_MAPPING);
	}

	@Test
	void requestsOneMappingLinePerPort() {
		// When
		Pod result = plugin.onPodUpdated(plugin.onPodAdded(clbPod()));

		// Then
		assertThat(result.getMetadata().getAnnotations())
				.containsEntry(TencentClbPlugin.PORT_MAPPING, "7777 TCP games-pod-0\n7778 UDP games-pod-0\n")
				.containsEntry(TencentClbPlugin.ENABLE_PORT_MAPPING, "true");
		assertThat(TestPods.status(result).getCurrentNetworkState()).isEqualTo(NetworkState.WAITING);
	}

	@Test
	void mappingsArePooledPerGameServer() {
		Pod pod = TestPods.withLabel(plugin.onPodAdded(clbPod()), NetworkLabel.GAME_SERVER.getLabel(), "lobby");

		Pod result = plugin.onPodUpdated(pod);

		assertThat(result.getMetadata().getAnnotations().get(TencentClbPlugin.PORT_MAPPING))
				.isEqualTo("7777 TCP games-lobby\n7778 UDP games-lobby\n");
	}

	@Test
	void disabledPodTurnsTheMappingOff() {
		Pod pod = TestPods.withLabel(plugin.onPodAdded(clbPod()), NetworkLabel.NETWORK_DISABLED.getLabel(), "true");

		Pod result = plugin.onPodUpdated(pod);

		assertThat(result.getMetadata().getAnnotations()).containsEntry(TencentClbPlugin.ENABLE_PORT_MAPPING, "false");
	}

	@Test
	void readyResultIsPublished() {
		// Given
		Pod pod = withResult(plugin.onPodAdded(clbPod()), "Ready",
				"[{\"port\":7777,\"protocol\":\"TCP\",\"address\":\"119.29.1.1:40000\"},"
				+ "{\"port\":7778,\"protocol\":\"UDP\",\"address\":\"119.29.1.1\"}]");

		// When
		Pod result = plugin.onPodUpdated(pod);

		// Then
		NetworkStatus status = TestPods.status(result);
		assertThat(status.getCurrentNetworkState()).isEqualTo(NetworkState.READY);
		assertThat(status.getExternalAddresses()).singleElement().satisfies(address -> {
			assertThat(address.getIp()).isEqualTo("119.29.1.1");
			assertThat(address.getPorts()).extracting(NetworkPort::getPort).containsExactly(40000);
		});
		assertThat(status.getInternalAddresses()).singleElement().satisfies(address -> {
			assertThat(address.getIp()).isEqualTo("10.0.0.7");
			assertThat(address.getPorts()).extracting(NetworkPort::getPort).containsExactly(7777);
		});
	}

	@Test
	void resultIsIgnoredUntilTheStatusIsReady() {
		Pod pod = withResult(plugin.onPodAdded(clbPod()), "Pending",
				"[{\"port\":7777,\"protocol\":\"TCP\",\"address\":\"119.29.1.1:40000\"}]");

		Pod result = plugin.onPodUpdated(pod);

		assertThat(TestPods.status(result).getCurrentNetworkState()).isEqualTo(NetworkState.WAITING);
	}

	@Test
	void unreadableResultIsAnInternalError() {
		Pod pod = withResult(plugin.onPodAdded(clbPod()), "Ready", "[{\"port\":");

		assertThatThrownBy(() -> plugin.onPodUpdated(pod))
				.isInstanceOf(PluginException.class)
				.satisfies(e -> assertThat(((PluginException) e).getType()).isEqualTo(PluginErrorType.INTERNAL));
	}

	@Test
	void terminatingPodIsLeftAlone() {
		Pod pod = new PodBuilder(plugin.onPodAdded(clbPod()))
				.editMetadata().withDeletionTimestamp("2026-10-19T10:00:00Z").endMetadata()
				.build();

		Pod result = plugin.onPodUpdated(pod);

		assertThat(result).isSameAs(pod);
	}

	private Pod clbPod() {
		return TestPods.pod("games", "pod-0", TencentClbPlugin.NAME, param("PortProtocols", "7777,7778/UDP"));
	}

	private Pod withResult(Pod pod, String status, String result) {
		return new PodBuilder(pod)
				.editMetadata()
					.addToAnnotations(TencentClbPlugin.PORT_MAPPING_STATUS, status)
					.addToAnnotations(TencentClbPlugin.PORT_MAPPING_RESULT, result)
				.endMetadata()
				.build();
	}
}
