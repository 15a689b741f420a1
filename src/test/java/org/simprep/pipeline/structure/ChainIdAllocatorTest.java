package org.simprep.pipeline.structure;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.simprep.pipeline.StateInconsistencyException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChainIdAllocatorTest {

    @Test
    void skipsIdentifiersAlreadyInUse() {
        ChainIdAllocator allocator = new ChainIdAllocator(List.of("A", "C"));

        assertThat(allocator.next()).isEqualTo("B");
        assertThat(allocator.next()).isEqualTo("D");
        assertThat(allocator.isUsed("B")).isTrue();
    }

    @Test
    void reservedIdentifiersAreNeverHandedOut() {
        ChainIdAllocator allocator = new ChainIdAllocator(List.of());
        allocator.reserve("A");

        assertThat(allocator.next()).isEqualTo("B");
    }

    @Test
    void runsOutAfterAllSingleCharacterIdentifiers() {
        ChainIdAllocator allocator = new ChainIdAllocator(List.of());
        List<String> handedOut = new ArrayList<>();
        for (int i = 0; i < 62; i++) {
            handedOut.add(allocator.next());
        }

        assertThat(handedOut).doesNotHaveDuplicates().contains("z", "9");
        assertThatThrownBy(allocator::next).isInstanceOf(StateInconsistencyException.class);
    }
}
