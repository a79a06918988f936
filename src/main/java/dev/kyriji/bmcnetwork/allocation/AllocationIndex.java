package dev.kyriji.bmcnetwork.allocation;

import dev.kyriji.bmcnetwork.objects.Allocation;
import dev.kyriji.bmcnetwork.objects.PortGrant;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps ownership keys to the ports they were granted. The index and its {@link PortPool} are only
 * touched under one lock per instance; callers never hold it across cluster I/O.
 *
 * An owner is either a single pod ({@code ns/pod}) or, in fixed mode, a whole workload
 * ({@code ns/workload}) whose pods each hold one member allocation.
 */
public class AllocationIndex {
	private final PortPool pool;
	private final Map<String, Allocation> allocations = new HashMap<>();
	private final Object lock = new Object();

	public AllocationIndex(PortPool pool) {
		this.pool = pool;
	}

	public Optional<Allocation> lookupOrAllocate(String ownerKey, List<String> candidateLbIds, int count) {
		return lookupOrAllocate(ownerKey, ownerKey, candidateLbIds, count);
	}

	public Optional<Allocation> lookupOrAllocate(String ownerKey, String memberKey, List<String> candidateLbIds, int count) {
		synchronized (lock) {
			Allocation existing = allocations.get(memberKey);
			if (existing != null && existing.getPorts().size() == count) {
				return Optional.of(existing);
			}

			// backend count changed, swap the grant but keep the old one if nothing fits
			if (existing != null) {
				pool.release(existing.getLoadBalancerId(), existing.getPorts());
			}

			Optional<PortGrant> grant = pool.tryAllocate(candidateLbIds, count);
			if (grant.isEmpty()) {
				if (existing != null) {
					pool.markUsed(existing.getLoadBalancerId(), existing.getPorts());
				}
				return Optional.empty();
			}

			Allocation allocation = Allocation.of(ownerKey, memberKey, grant.get());
			allocations.put(memberKey, allocation);
			return Optional.of(allocation);
		}
	}

	public Optional<Allocation> lookup(String memberKey) {
		synchronized (lock) {
			return Optional.ofNullable(allocations.get(memberKey));
		}
	}

	/**
	 * Releases every allocation held by the owner. Only the first of several concurrent callers finds
	 * the entries; the others get an empty list.
	 */
	public List<Allocation> release(String ownerKey) {
		synchronized (lock) {
			List<Allocation> released = new ArrayList<>();
			Iterator<Allocation> iterator = allocations.values().iterator();
			while (iterator.hasNext()) {
				Allocation allocation = iterator.next();
				if (!allocation.getOwnerKey().equals(ownerKey)) continue;

				pool.release(allocation.getLoadBalancerId(), allocation.getPorts());
				iterator.remove();
				released.add(allocation);
			}
			return released;
		}
	}

	/**
	 * Replays an allocation recorded on an existing cluster object. Must finish before the first
	 * {@link #lookupOrAllocate} call after a restart.
	 *
	 * @return the allocation as recorded, limited to the ports inside the pool range
	 */
	public Optional<Allocation> restore(Allocation recorded) {
		synchronized (lock) {
			List<Integer> applied = pool.markUsed(recorded.getLoadBalancerId(), recorded.getPorts());
			if (applied.isEmpty()) return Optional.empty();

			Allocation allocation = new Allocation(recorded.getOwnerKey(), recorded.getMemberKey(), recorded.getLoadBalancerId(), applied);
			allocations.put(allocation.getMemberKey(), allocation);
			return Optional.of(allocation);
		}
	}

	public int freeCount(String lbId) {
		synchronized (lock) {
			return pool.freeCount(lbId);
		}
	}

	public boolean isUsed(String lbId, int port) {
		synchronized (lock) {
			return pool.isUsed(lbId, port);
		}
	}

	public Set<String> ownerKeys() {
		synchronized (lock) {
			Set<String> keys = new TreeSet<>();
			for (Allocation allocation : allocations.values()) {
				keys.add(allocation.getOwnerKey());
			}
			return keys;
		}
	}

	public int size() {
		synchronized (lock) {
			return allocations.size();
		}
	}
}
