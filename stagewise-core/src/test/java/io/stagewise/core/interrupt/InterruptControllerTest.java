package io.stagewise.core.interrupt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class InterruptControllerTest {

    @Test
    void shouldSuspendWhenNoValueIsPending() {
        InterruptController.Slot slot = InterruptController.none().slotFor("stage_1/ask");

        assertThatThrownBy(() -> slot.suspend("Please clarify"))
                .isInstanceOfSatisfying(SuspendSignal.class, signal -> {
                    assertThat(signal.interrupt().nodeId()).isEqualTo("stage_1/ask");
                    assertThat(signal.interrupt().message()).isEqualTo("Please clarify");
                    assertThat(signal.interrupt().createdAt()).isNotNull();
                });
    }

    @Test
    void shouldDeliverResumeValueOnlyToSuspendedNode() {
        InterruptController controller = InterruptController.resuming("stage_1/ask", "pass");

        assertThat(controller.slotFor("stage_1/ask").suspend("again?")).isEqualTo("pass");
        assertThatThrownBy(() -> controller.slotFor("stage_1/other").suspend("?"))
                .isInstanceOf(SuspendSignal.class);
    }

    @Test
    void shouldRejectSecondSuspendInOneInvocation() {
        InterruptController.Slot slot = InterruptController.resuming("ask", "yes").slotFor("ask");
        slot.suspend("first");

        assertThatThrownBy(() -> slot.suspend("second"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("suspended twice");
    }
}
