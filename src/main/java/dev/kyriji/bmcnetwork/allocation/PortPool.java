package dev.kyriji.bmcnetwork.allocation;

import dev.kyriji.bmcnetwork.objects.PortGrant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per load balancer usage bitmap over an inclusive {@code [minPort, maxPort]} range.
 *
 * A slot is marked used when it is held by an allocation or statically blocked. The pool is not
 * thread-safe; {@link AllocationIndex} owns it and serialises every call.
 */
public class PortPool {
	private final int minPort;
	private final int maxPort;
	private final Set<Integer> blockedPorts;
	private final Map<String, boolean[]> allocated = new LinkedHashMap<>();

	public PortPool(int minPort, int maxPort, Collection<Integer> blockedPorts) {
		if (minPort <= 0 || maxPort > 65535 || minPort > maxPort) {
			throw new IllegalArgumentException("Invalid port range [" + minPort + ", " + maxPort + "]");
		}
		this.minPort = minPort;
		this.maxPort = maxPort;

		Set<Integer> blocked = new TreeSet<>();
		if (blockedPorts != null) {
			for (Integer port : blockedPorts) {
				if (port != null && inRange(port)) blocked.add(port);
			}
		}
		this.blockedPorts = Collections.unmodifiableSet(blocked);
	}

	public void ensure(String lbId) {
		allocated.computeIfAbsent(lbId, id -> {
			boolean[] bitmap = new boolean[maxPort - minPort + 1];
			for (int port : blockedPorts) {
				bitmap[port - minPort] = true;
			}
			return bitmap;
		});
	}

	/**
	 * First-fit over the candidates in the given order, then the lowest free ports of that load balancer.
	 *
	 * @return the grant, or empty when no candidate has {@code count} free ports
	 * @throws IllegalArgumentException if {@code count} is not positive
	 */
	public Optional<PortGrant> tryAllocate(List<String> candidateLbIds, int count) {
		if (count <= 0) {
			throw new IllegalArgumentException("Port count must be positive, got " + count);
		}

		for (String lbId : candidateLbIds) {
			ensure(lbId);
			if (freeCount(lbId) < count) continue;

			boolean[] bitmap = allocated.get(lbId);
			List<Integer> ports = new ArrayList<>(count);
			for (int i = 0; i < bitmap.length && ports.size() < count; i++) {
				if (!bitmap[i]) {
					bitmap[i] = true;
					ports.add(minPort + i);
				}
			}
			return Optional.of(new PortGrant(lbId, ports));
		}

		return Optional.empty();
	}

	public void release(String lbId, Collection<Integer> ports) {
		boolean[] bitmap = allocated.get(lbId);
		if (bitmap == null) return;

		for (int port : ports) {
			if (inRange(port)) bitmap[port - minPort] = false;
		}
		for (int port : blockedPorts) {
			bitmap[port - minPort] = true;
		}
	}

	/**
	 * Marks ports found on an existing cluster object as used. Ports outside the range are not managed
	 * by this pool and are skipped.
	 *
	 * @return the ports that were applied
	 */
	public List<Integer> markUsed(String lbId, Collection<Integer> ports) {
		ensure(lbId);
		boolean[] bitmap = allocated.get(lbId);
		List<Integer> applied = new ArrayList<>();
		for (int port : ports) {
			if (!inRange(port)) continue;
			bitmap[port - minPort] = true;
			applied.add(port);
		}
		return applied;
	}

	public boolean isUsed(String lbId, int port) {
		boolean[] bitmap = allocated.get(lbId);
		if (bitmap == null || !inRange(port)) return false;
		return bitmap[port - minPort];
	}

	public int freeCount(String lbId) {
		boolean[] bitmap = allocated.get(lbId);
		if (bitmap == null) return capacity() - blockedPorts.size();

		int free = 0;
		for (boolean used : bitmap) {
			if (!used) free++;
		}
		return free;
	}

	public boolean inRange(int port) {
		return port >= minPort && port <= maxPort;
	}

	public int capacity() {
		return maxPort - minPort + 1;
	}

	public Set<String> getLoadBalancerIds() {
		return Collections.unmodifiableSet(allocated.keySet());
	}

	public int getMinPort() {
		return minPort;
	}

	public int getMaxPort() {
		return maxPort;
	}

	public Set<Integer> getBlockedPorts() {
		return blockedPorts;
	}
}
