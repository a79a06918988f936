package dev.kyriji.bmcnetwork.allocation;

import dev.kyriji.bmcnetwork.objects.Allocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationIndexTest {
	private static final List<String> LBS = List.of("lb-a", "lb-b");

	private AllocationIndex index;

	@BeforeEach
	void setUp() {
		index = new AllocationIndex(new PortPool(500, 509, Set.of()));
	}

	@Test
	void lookupOrAllocateIsIdempotent() {
		// When
		Allocation first = index.lookupOrAllocate("ns/pod-0", LBS, 2).orElseThrow();
		Allocation second = index.lookupOrAllocate("ns/pod-0", LBS, 2).orElseThrow();

		// Then
		assertThat(second).isEqualTo(first);
		assertThat(index.freeCount("lb-a")).isEqualTo(8);
	}

	@Test
	void releaseReturnsPortsToThePool() {
		// Given
		Allocation allocation = index.lookupOrAllocate("ns/pod-0", LBS, 3).orElseThrow();

		// When
		List<Allocation> released = index.release("ns/pod-0");

		// Then
		assertThat(released).containsExactly(allocation);
		assertThat(index.freeCount("lb-a")).isEqualTo(10);
		assertThat(index.lookup("ns/pod-0")).isEmpty();
		assertThat(index.release("ns/pod-0")).isEmpty();
	}

	@Test
	void fixedOwnerReleasesAllMembersAtOnce() {
		// Given
		index.lookupOrAllocate("ns/gs", "ns/gs-0", LBS, 2).orElseThrow();
		index.lookupOrAllocate("ns/gs", "ns/gs-1", LBS, 2).orElseThrow();
		index.lookupOrAllocate("ns/other", LBS, 1).orElseThrow();

		// When
		List<Allocation> released = index.release("ns/gs");

		// Then
		assertThat(released).extracting(Allocation::getMemberKey).containsExactlyInAnyOrder("ns/gs-0", "ns/gs-1");
		assertThat(index.ownerKeys()).containsExactly("ns/other");
		assertThat(index.freeCount("lb-a")).isEqualTo(9);
	}

	@Test
	void backendCountChangeSwapsTheGrant() {
		// Given
		index.lookupOrAllocate("ns/pod-0", LBS, 2).orElseThrow();

		// When
		Allocation changed = index.lookupOrAllocate("ns/pod-0", LBS, 3).orElseThrow();

		// Then
		assertThat(changed.getPorts()).hasSize(3);
		assertThat(index.freeCount("lb-a")).isEqualTo(7);
		assertThat(index.size()).isEqualTo(1);
	}

	@Test
	void backendCountChangeKeepsOldGrantWhenNothingFits() {
		// Given
		Allocation original = index.lookupOrAllocate("ns/pod-0", List.of("lb-a"), 2).orElseThrow();
		index.lookupOrAllocate("ns/pod-1", List.of("lb-a"), 8).orElseThrow();

		// When
		Optional<Allocation> changed = index.lookupOrAllocate("ns/pod-0", List.of("lb-a"), 3);

		// Then
		assertThat(changed).isEmpty();
		assertThat(index.lookup("ns/pod-0")).contains(original);
		assertThat(index.freeCount("lb-a")).isZero();
	}

	@Test
	void restoreReplaysRecordedPorts() {
		// When
		Optional<Allocation> restored = index.restore(new Allocation("ns/gs", "ns/gs-0", "lb-a", List.of(500, 501, 9000)));

		// Then
		assertThat(restored).get().extracting(Allocation::getPorts).isEqualTo(List.of(500, 501));
		assertThat(index.isUsed("lb-a", 500)).isTrue();
		assertThat(index.lookupOrAllocate("ns/new", List.of("lb-a"), 1)).get()
				.extracting(Allocation::getPorts).isEqualTo(List.of(502));
	}

	@Test
	void restoreSkipsAllocationsEntirelyOutsideTheRange() {
		assertThat(index.restore(new Allocation("ns/pod", "ns/pod", "lb-a", List.of(80, 443)))).isEmpty();
		assertThat(index.size()).isZero();
	}

	@Test
	void concurrentAllocationsNeverShareAPort() throws Exception {
		// Given
		AllocationIndex large = new AllocationIndex(new PortPool(1000, 1999, Set.of()));
		ExecutorService executor = Executors.newFixedThreadPool(8);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Optional<Allocation>>> futures = new ArrayList<>();

		// When
		for (int i = 0; i < 200; i++) {
			String owner = "ns/pod-" + i;
			Callable<Optional<Allocation>> task = () -> {
				start.await();
				return large.lookupOrAllocate(owner, List.of("lb-a", "lb-b"), 3);
			};
			futures.add(executor.submit(task));
		}
		start.countDown();

		Set<String> seen = new HashSet<>();
		int granted = 0;
		for (Future<Optional<Allocation>> future : futures) {
			Optional<Allocation> allocation = future.get(10, TimeUnit.SECONDS);
			if (allocation.isEmpty()) continue;
			granted++;
			for (int port : allocation.get().getPorts()) {
				assertThat(seen.add(allocation.get().getLoadBalancerId() + ":" + port)).isTrue();
			}
		}
		executor.shutdownNow();

		// Then
		assertThat(granted).isEqualTo(200);
		assertThat(large.freeCount("lb-a") + large.freeCount("lb-b")).isEqualTo(2000 - 600);
	}

	@Test
	void concurrentReleaseOfOneOwnerHappensOnce() throws Exception {
		// Given
		index.lookupOrAllocate("ns/gs", "ns/gs-0", LBS, 2).orElseThrow();
		index.lookupOrAllocate("ns/gs", "ns/gs-1", LBS, 2).orElseThrow();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<List<Allocation>>> futures = new ArrayList<>();

		// When
		for (int i = 0; i < 4; i++) {
			futures.add(executor.submit(() -> {
				start.await();
				return index.release("ns/gs");
			}));
		}
		start.countDown();

		int releasedTotal = 0;
		for (Future<List<Allocation>> future : futures) {
			releasedTotal += future.get(10, TimeUnit.SECONDS).size();
		}
		executor.shutdownNow();

		// Then
		assertThat(releasedTotal).isEqualTo(2);
		assertThat(index.freeCount("lb-a")).isEqualTo(10);
	}
}
