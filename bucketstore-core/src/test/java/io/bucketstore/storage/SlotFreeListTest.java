package io.bucketstore.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlotFreeListTest {

    @Test
    void popOnEmptyReturnsMinusOne() {
        SlotFreeList freeList = new SlotFreeList(4);

        assertThat(freeList.isEmpty()).isTrue();
        assertThat(freeList.pop()).isEqualTo(-1);
    }

    @Test
    void popsMostRecentlyPushedFirst() {
        SlotFreeList freeList = new SlotFreeList(4);
        freeList.push(3);
        freeList.push(0);
        freeList.push(2);

        assertThat(freeList.size()).isEqualTo(3);
        assertThat(freeList.pop()).isEqualTo(2);
        assertThat(freeList.pop()).isEqualTo(0);
        assertThat(freeList.pop()).isEqualTo(3);
        assertThat(freeList.isEmpty()).isTrue();
    }

    @Test
    void growsUpToBucketCapacity() {
        SlotFreeList freeList = new SlotFreeList(100);
        for (int slot = 0; slot < 100; slot++) {
            freeList.push(slot);
        }

        assertThat(freeList.size()).isEqualTo(100);
        assertThat(freeList.pop()).isEqualTo(99);
    }

    @Test
    void clearEmptiesTheStack() {
        SlotFreeList freeList = new SlotFreeList(2);
        freeList.push(1);
        freeList.clear();

        assertThat(freeList.isEmpty()).isTrue();
        assertThat(freeList.pop()).isEqualTo(-1);
    }
}
