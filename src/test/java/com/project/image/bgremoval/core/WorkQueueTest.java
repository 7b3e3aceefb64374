package com.project.image.bgremoval.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkQueueTest {

    @Test
    void removesInInsertionOrder() {
        WorkQueue queue = new WorkQueue(3);
        queue.add(7);
        queue.add(2);
        queue.add(9);

        assertThat(queue.remove()).isEqualTo(7);
        assertThat(queue.remove()).isEqualTo(2);
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.remove()).isEqualTo(9);
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.enqueuedCount()).isEqualTo(3);
    }

    @Test
    void addingBeyondCapacity_fails() {
        WorkQueue queue = new WorkQueue(1);
        queue.add(0);
        queue.remove();

        assertThatThrownBy(() -> queue.add(0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void removingFromEmptyQueue_fails() {
        assertThatThrownBy(() -> new WorkQueue(4).remove()).isInstanceOf(IllegalStateException.class);
    }
}
