package alertmigrator.dedup;

import alertmigrator.config.MigrationConfig;
import alertmigrator.exceptions.DeduplicationExhaustedException;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UidAllocatorTest {

    @Test
    void generatedUidsHaveConfiguredLength() throws DeduplicationExhaustedException {
        UidAllocator allocator = new UidAllocator(MigrationConfig.DEFAULTS);

        String uid = allocator.allocate();

        assertThat(uid).hasSize(14).matches("[a-z][a-z0-9]*");
        assertThat(allocator.isTaken(uid)).isTrue();
    }

    @Test
    void collisionsAreRetried() throws DeduplicationExhaustedException {
        Deque<String> candidates = new ArrayDeque<>(List.of("aaa", "aaa", "bbb"));
        UidAllocator allocator = new UidAllocator(40, 5, candidates::poll);

        assertThat(allocator.allocate()).isEqualTo("aaa");
        assertThat(allocator.allocate()).isEqualTo("bbb");
    }

    @Test
    void reservedUidsAreNeverIssued() {
        UidAllocator allocator = new UidAllocator(40, 3, () -> "taken");
        assertThat(allocator.reserve("taken")).isTrue();
        assertThat(allocator.reserve("taken")).isFalse();

        assertThatThrownBy(allocator::allocate).isInstanceOf(DeduplicationExhaustedException.class);
    }

    @Test
    void candidatesAreCutToMaximumLength() throws DeduplicationExhaustedException {
        UidAllocator allocator = new UidAllocator(4, 1, () -> "abcdefgh");

        assertThat(allocator.allocate()).isEqualTo("abcd");
    }

    @Test
    void concurrentAllocationsAreUnique() throws Exception {
        UidAllocator allocator = new UidAllocator(MigrationConfig.DEFAULTS);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                futures.add(pool.submit(allocator::allocate));
            }
            for (Future<String> f : futures) {
                seen.add(f.get());
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(500);
        assertThat(allocator.size()).isEqualTo(500);
    }

    @Test
    void shortUidStartsWithLetter() {
        for (int i = 0; i < 50; i++) {
            assertThat(ShortUid.generate(10)).hasSize(10).matches("[a-z][a-z0-9]{9}");
        }
    }
}
