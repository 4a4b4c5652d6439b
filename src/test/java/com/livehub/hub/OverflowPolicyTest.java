package com.livehub.hub;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class OverflowPolicyTest {

	@Test
	void dropOldestKeepsMostRecentElementsBehindOneDropNotice() {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("oldest", 4, OverflowPolicy.DROP_OLDEST));
		Inlet<Integer> inlet = hub.claimInlet("test");

		StepVerifier.create(hub.flux(Schedulers.immediate()), 0)
				.then(() -> IntStream.rangeClosed(1, 10).forEach(inlet::push))
				.thenRequest(Long.MAX_VALUE)
				.expectNext(HubSignal.<Integer>dropped(6), HubSignal.next(7), HubSignal.next(8), HubSignal.next(9),
						HubSignal.next(10))
				.then(() -> assertThat(hub.status().dropped()).isEqualTo(6))
				.thenCancel()
				.verify(Duration.ofSeconds(5));
	}

	@Test
	void dropNewestKeepsEarliestElementsAndAnnouncesTheLoss() {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("newest", 3, OverflowPolicy.DROP_NEWEST));
		Inlet<Integer> inlet = hub.claimInlet("test");

		StepVerifier.create(hub.flux(Schedulers.immediate()), 0)
				.then(() -> IntStream.rangeClosed(1, 5).forEach(inlet::push))
				.thenRequest(2)
				.expectNext(HubSignal.<Integer>dropped(2), HubSignal.next(1))
				.then(() -> inlet.push(6))
				.thenRequest(3)
				.expectNext(HubSignal.next(2), HubSignal.next(3), HubSignal.next(6))
				.thenCancel()
				.verify(Duration.ofSeconds(5));

		assertThat(hub.status().dropped()).isEqualTo(2);
	}

	@Test
	void dropPolicyAffectsOnlyTheSlowSubscriber() {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("isolated", 2, OverflowPolicy.DROP_OLDEST));
		Inlet<Integer> inlet = hub.claimInlet("test");
		List<Integer> fastSeen = new ArrayList<>();
		hub.attach(signal -> fastSeen.add(signal.element()), Schedulers.immediate());

		StepVerifier.create(hub.flux(Schedulers.immediate()), 0)
				.then(() -> IntStream.rangeClosed(1, 6).forEach(inlet::push))
				.then(() -> {
					assertThat(fastSeen).containsExactly(1, 2, 3, 4, 5, 6);
					assertThat(hub.status().dropped()).isEqualTo(4);
				})
				.thenCancel()
				.verify(Duration.ofSeconds(5));
	}

	@Test
	void slowFluxConsumerNeitherPacesProducerNorSiblings() throws Exception {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("paced", 2, OverflowPolicy.DROP_OLDEST));
		Inlet<Integer> inlet = hub.claimInlet("test");
		List<HubSignal<Integer>> slowSeen = new CopyOnWriteArrayList<>();
		CountDownLatch slowDone = new CountDownLatch(1);
		hub.flux()
				.doOnNext(signal -> LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(200)))
				.subscribe(slowSeen::add, error -> slowDone.countDown(), slowDone::countDown);
		List<Integer> fastSeen = new ArrayList<>();
		hub.attach(signal -> {
			if (signal.isElement()) {
				fastSeen.add(signal.element());
			}
		}, Schedulers.immediate());

		long started = System.nanoTime();
		IntStream.rangeClosed(1, 10).forEach(inlet::push);
		long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

		assertThat(elapsedMs).isLessThan(500);
		assertThat(fastSeen).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
		assertThat(hub.status().dropped()).isPositive();

		inlet.complete();
		assertThat(slowDone.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(slowSeen).anyMatch(HubSignal::isDropped);
		assertThat(slowSeen.get(slowSeen.size() - 1)).isEqualTo(HubSignal.next(10));
	}

	@Test
	void failFastTerminatesWholeHubWithHubFailed() {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("strict", 2, OverflowPolicy.FAIL_FAST));
		Inlet<Integer> inlet = hub.claimInlet("test");
		List<HubSignal<Integer>> other = new ArrayList<>();
		hub.attach(other::add, Schedulers.immediate());

		StepVerifier.create(hub.flux(Schedulers.immediate()), 0)
				.then(() -> {
					inlet.push(1);
					inlet.push(2);
					inlet.push(3);
				})
				.then(() -> {
					assertThat(hub.state()).isEqualTo(HubState.FAILED);
					assertThat(inlet.isOpen()).isFalse();
				})
				.thenRequest(Long.MAX_VALUE)
				.thenConsumeWhile(HubSignal::isElement)
				.expectErrorSatisfies(error -> assertThat(error)
						.isInstanceOf(HubFailedException.class)
						.hasCauseInstanceOf(SubscriberOverflowException.class))
				.verify(Duration.ofSeconds(5));

		HubSignal<Integer> last = other.get(other.size() - 1);
		assertThat(last.kind()).isEqualTo(HubSignal.Kind.FAILED);
		assertThat(last.error())
				.isInstanceOf(HubFailedException.class)
				.hasCauseInstanceOf(SubscriberOverflowException.class);
	}

	@Test
	void failFastOverflowOfSlowFluxConsumerFailsTheHub() throws Exception {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("strict-flux", 2, OverflowPolicy.FAIL_FAST));
		Inlet<Integer> inlet = hub.claimInlet("test");
		CountDownLatch failed = new CountDownLatch(1);
		List<Throwable> errors = new CopyOnWriteArrayList<>();
		hub.flux()
				.doOnNext(signal -> LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(200)))
				.subscribe(signal -> {
				}, error -> {
					errors.add(error);
					failed.countDown();
				});

		for (int i = 1; i <= 10 && inlet.isOpen(); i++) {
			inlet.push(i);
		}

		assertThat(hub.state()).isEqualTo(HubState.FAILED);
		assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(errors).hasSize(1);
		assertThat(errors.get(0))
				.isInstanceOf(HubFailedException.class)
				.hasCauseInstanceOf(SubscriberOverflowException.class);
	}

	@Test
	void blockProducerWaitsUntilSubscriberDrains() throws Exception {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("blocking", 1, OverflowPolicy.BLOCK_PRODUCER));
		Inlet<Integer> inlet = hub.claimInlet("test");
		CountDownLatch release = new CountDownLatch(1);
		List<Integer> seen = new CopyOnWriteArrayList<>();
		hub.attach(signal -> {
			if (signal.isElement()) {
				awaitQuietly(release);
				seen.add(signal.element());
			}
		});
		inlet.push(1);
		CountDownLatch secondPushed = new CountDownLatch(1);

		Thread producer = new Thread(() -> {
			inlet.push(2);
			secondPushed.countDown();
		}, "blocked-producer");
		producer.start();

		assertThat(secondPushed.await(200, TimeUnit.MILLISECONDS)).isFalse();
		release.countDown();
		assertThat(secondPushed.await(5, TimeUnit.SECONDS)).isTrue();
		producer.join(5000);
		inlet.complete();
		awaitSize(seen, 2);
		assertThat(seen).containsExactly(1, 2);
	}

	@Test
	void blockedProducerIsReleasedWhenSubscriberDetaches() throws Exception {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("released", 1, OverflowPolicy.BLOCK_PRODUCER));
		Inlet<Integer> inlet = hub.claimInlet("test");
		CountDownLatch release = new CountDownLatch(1);
		HubSubscription<Integer> subscription = hub.attach(signal -> awaitQuietly(release));
		inlet.push(1);
		CountDownLatch secondPushed = new CountDownLatch(1);

		Thread producer = new Thread(() -> {
			inlet.push(2);
			secondPushed.countDown();
		}, "blocked-producer");
		try {
			producer.start();

			assertThat(secondPushed.await(200, TimeUnit.MILLISECONDS)).isFalse();
			subscription.detach();
			assertThat(secondPushed.await(5, TimeUnit.SECONDS)).isTrue();
			assertThat(hub.state()).isEqualTo(HubState.RUNNING);
		} finally {
			release.countDown();
			producer.join(5000);
		}
	}

	@Test
	void shutdownReleasesBlockedProducer() throws Exception {
		BroadcastHub<Integer> hub = new BroadcastHub<>(new HubSettings("owner-stop", 1, OverflowPolicy.BLOCK_PRODUCER));
		Inlet<Integer> inlet = hub.claimInlet("test");
		CountDownLatch release = new CountDownLatch(1);
		hub.attach(signal -> awaitQuietly(release));
		inlet.push(1);
		CountDownLatch secondReturned = new CountDownLatch(1);

		Thread producer = new Thread(() -> {
			inlet.push(2);
			secondReturned.countDown();
		}, "blocked-producer");
		try {
			producer.start();

			assertThat(secondReturned.await(200, TimeUnit.MILLISECONDS)).isFalse();
			hub.shutdown();
			assertThat(secondReturned.await(5, TimeUnit.SECONDS)).isTrue();
			assertThat(hub.state()).isEqualTo(HubState.COMPLETED);
		} finally {
			release.countDown();
			producer.join(5000);
		}
	}

	private static void awaitQuietly(CountDownLatch latch) {
		try {
			latch.await(5, TimeUnit.SECONDS);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
		}
	}

	private static void awaitSize(List<?> list, int size) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 5000;
		while (list.size() < size && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
	}
}
