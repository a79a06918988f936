package dev.kyriji.bmcnetwork;

import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.controller.InformerManager;
import dev.kyriji.bmcnetwork.controller.PodNetworkReconciler;
import dev.kyriji.bmcnetwork.controller.ReconciliationQueue;
import dev.kyriji.bmcnetwork.controllers.ProviderManager;
import dev.kyriji.bmcnetwork.network.LoadBalancerPlugin;
import dev.kyriji.bmcnetwork.providers.aws.AwsNlbAdapter;
import dev.kyriji.bmcnetwork.providers.hwcloud.HwCloudElbAdapter;
import dev.kyriji.bmcnetwork.providers.jdcloud.JdCloudNlbAdapter;
import dev.kyriji.bmcnetwork.providers.kubernetes.HostPortPlugin;
import dev.kyriji.bmcnetwork.providers.kubernetes.NodePortAdapter;
import dev.kyriji.bmcnetwork.providers.tencent.TencentClbPlugin;
import dev.kyriji.bmcnetwork.utils.DurationParser;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import java.util.Map;

public class BMCNetwork {
	public static ProviderManager providerManager;
	public static InformerManager informerManager;
	public static KubernetesClient kubernetesClient;

	public static void main(String[] args) {
		System.out.println("=== Starting BMC Network ===");
		Map<String, String> env = System.getenv();

		long requeueDelay = DurationParser.parseOrDefault(env.get("BMC_NETWORK_REQUEUE_DELAY"), 5_000L);
		long resyncPeriod = DurationParser.parseOrDefault(env.get("BMC_NETWORK_RESYNC_PERIOD"), 10 * 60 * 1000L);
		long pollInterval = DurationParser.parseOrDefault(env.get("BMC_NETWORK_HANDSHAKE_POLL_INTERVAL"), 2_000L);
		long pollTimeout = DurationParser.parseOrDefault(env.get("BMC_NETWORK_HANDSHAKE_POLL_TIMEOUT"), 30_000L);
		int workers = Integer.parseInt(env.getOrDefault("BMC_NETWORK_WORKERS", "4"));

		// Initialize Kubernetes client
		kubernetesClient = new KubernetesClientBuilder().build();

		// Register the enabled plugins and rebuild their allocations
		providerManager = registerPlugins(env, pollInterval, pollTimeout);
		providerManager.initAll(kubernetesClient);

		// Setup event-driven controller with informers
		System.out.println("Setting up pod network controller...");
		ReconciliationQueue queue = new ReconciliationQueue();
		PodNetworkReconciler reconciler = new PodNetworkReconciler(kubernetesClient, providerManager, requeueDelay, resyncPeriod);
		informerManager = new InformerManager(kubernetesClient, queue, reconciler, workers, resyncPeriod);
		informerManager.setupInformers();
		informerManager.start();

		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			informerManager.shutdown();
			kubernetesClient.close();
		}, "shutdown"));

		System.out.println("=== BMC Network started successfully ===");
	}

	static ProviderManager registerPlugins(Map<String, String> env, long pollInterval, long pollTimeout) {
		ProviderManager manager = new ProviderManager();

		PluginOptions aws = PluginOptions.fromEnv(env, AwsNlbAdapter.OPTIONS_PREFIX, false, 32768, 32817);
		if (aws.isEnabled()) {
			manager.register(new LoadBalancerPlugin(new AwsNlbAdapter(aws, pollInterval, pollTimeout)));
		}

		PluginOptions hwcloud = PluginOptions.fromEnv(env, HwCloudElbAdapter.OPTIONS_PREFIX, false, 30000, 30199);
		if (hwcloud.isEnabled()) {
			manager.register(new LoadBalancerPlugin(new HwCloudElbAdapter(hwcloud)));
		}

		PluginOptions jdcloud = PluginOptions.fromEnv(env, JdCloudNlbAdapter.OPTIONS_PREFIX, false, 30000, 30199);
		if (jdcloud.isEnabled()) {
			manager.register(new LoadBalancerPlugin(new JdCloudNlbAdapter(jdcloud)));
		}

		PluginOptions nodePort = PluginOptions.fromEnv(env, NodePortAdapter.OPTIONS_PREFIX, true, 30000, 32767);
		if (nodePort.isEnabled()) {
			manager.register(new LoadBalancerPlugin(new NodePortAdapter(nodePort)));
		}

		PluginOptions hostPort = PluginOptions.fromEnv(env, HostPortPlugin.OPTIONS_PREFIX, false, 8000, 9000);
		if (hostPort.isEnabled()) {
			manager.register(new HostPortPlugin(hostPort));
		}

		PluginOptions tencent = PluginOptions.fromEnv(env, TencentClbPlugin.OPTIONS_PREFIX, false, 1, 65535);
		if (tencent.isEnabled()) {
			manager.register(new TencentClbPlugin());
		}

		return manager;
	}
}
