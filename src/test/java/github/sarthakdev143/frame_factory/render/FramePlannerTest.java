package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.FrameRange;
import github.sarthakdev143.frame_factory.model.ImageFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FramePlannerTest {

    @Test
    void planCoversWholeCompositionWithoutRange() {
        FramePlan plan = FramePlanner.plan(100, null);

        assertThat(plan.frameCount()).isEqualTo(100);
        assertThat(plan.frames().get(0)).isZero();
        assertThat(plan.lastFrame()).isEqualTo(99);
        assertThat(plan.padLength()).isEqualTo(2);
        assertThat(plan.fileNameFor(0, ImageFormat.JPEG)).isEqualTo("element-00.jpeg");
        assertThat(plan.fileNameFor(99, ImageFormat.JPEG)).isEqualTo("element-99.jpeg");
    }

    @Test
    void planUsesPadWidthOfLastFrameNotFrameCount() {
        FramePlan plan = FramePlanner.plan(101, null);

        assertThat(plan.padLength()).isEqualTo(3);
        assertThat(plan.fileNameFor(7, ImageFormat.PNG)).isEqualTo("element-007.png");
    }

    @Test
    void planResolvesInclusivePair() {
        FramePlan plan = FramePlanner.plan(100, FrameRange.between(10, 12));

        assertThat(plan.frames()).containsExactly(10, 11, 12);
        assertThat(plan.padLength()).isEqualTo(2);
    }

    @Test
    void planResolvesSingleFrame() {
        FramePlan plan = FramePlanner.plan(30, FrameRange.single(7));

        assertThat(plan.frames()).containsExactly(7);
        assertThat(plan.padLength()).isEqualTo(1);
        assertThat(FramePlanner.initialFrame(FrameRange.single(7))).isEqualTo(7);
    }

    @Test
    void planOfSingleFrameCompositionHasPadWidthOne() {
        FramePlan plan = FramePlanner.plan(1, null);

        assertThat(plan.frames()).containsExactly(0);
        assertThat(plan.fileNameFor(0, ImageFormat.PNG)).isEqualTo("element-0.png");
    }

    @Test
    void planRejectsSingleFrameOutsideComposition() {
        assertThatThrownBy(() -> FramePlanner.plan(30, FrameRange.single(30)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("between 0 and 29");
        assertThatThrownBy(() -> FramePlanner.plan(30, FrameRange.single(-1)))
                .isInstanceOf(RenderConfigurationException.class);
    }

    @Test
    void planRejectsInvalidPairs() {
        assertThatThrownBy(() -> FramePlanner.plan(30, FrameRange.between(5, 4)))
                .isInstanceOf(RenderConfigurationException.class);
        assertThatThrownBy(() -> FramePlanner.plan(30, FrameRange.between(20, 30)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("0-29");
        assertThatThrownBy(() -> FramePlanner.plan(30, FrameRange.between(-2, 3)))
                .isInstanceOf(RenderConfigurationException.class);
    }

    @Test
    void planRejectsNonPositiveDuration() {
        assertThatThrownBy(() -> FramePlanner.plan(0, null))
                .isInstanceOf(RenderConfigurationException.class);
    }
}
