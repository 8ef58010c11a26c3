package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.ImageAsset;
import com.example.autoslides_backend.model.Region;
import com.example.autoslides_backend.model.ScriptEntry;
import com.example.autoslides_backend.model.SlideSpec;
import com.example.autoslides_backend.util.LayoutMode;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SlideComposerTest {

    private final SlideComposer composer = new SlideComposer(new DeckProperties());

    private static ImageAsset img(int n) {
        return ImageAsset.remote("https://i/" + n + ".jpg", null, null, null);
    }

    @Test
    void splitsTextAndImageColumns() {
        SlideSpec spec = composer.compose(1, new ScriptEntry("Title", List.of("one", "two"), null), List.of(img(1)));

        assertThat(spec.layout().mode()).isEqualTo(LayoutMode.TEXT_AND_IMAGES);
        Region text = spec.layout().text();
        Region images = spec.layout().imageArea();
        assertThat(text.x()).isCloseTo(28.8, within(0.001));
        assertThat(text.y()).isCloseTo(108, within(0.001));
        assertThat(text.x() + text.width()).isLessThanOrEqualTo(720 * 0.55);
        assertThat(images.x()).isGreaterThanOrEqualTo(720 * 0.55);
        assertThat(images.x() + images.width()).isCloseTo(720 - 28.8, within(0.001));
        assertThat(spec.layout().imageSlots()).hasSize(1);
        Region slot = spec.layout().imageSlots().get(0);
        assertThat(slot.width()).isLessThanOrEqualTo(252);
        assertThat(slot.height()).isLessThanOrEqualTo(216);
        assertThat(spec.layout().bodyFontSize()).isEqualTo(18);
    }

    @Test
    void zeroImagesCollapseImageRegionAndWidenText() {
        SlideSpec withImage = composer.compose(1, new ScriptEntry("T", List.of("b"), null), List.of(img(1)));
        SlideSpec textOnly = composer.compose(1, new ScriptEntry("T", List.of("b"), null), List.of());

        assertThat(textOnly.layout().mode()).isEqualTo(LayoutMode.TEXT_ONLY);
        assertThat(textOnly.layout().imageArea().isEmpty()).isTrue();
        assertThat(textOnly.layout().imageSlots()).isEmpty();
        assertThat(textOnly.layout().text().width()).isGreaterThan(withImage.layout().text().width());
        assertThat(textOnly.layout().text().width()).isCloseTo(720 - 2 * 28.8, within(0.001));
    }

    @Test
    void twoColumnGridForSeveralImages() {
        SlideSpec spec = composer.compose(1, new ScriptEntry("T", List.of(), null), List.of(img(1), img(2), img(3)));

        List<Region> slots = spec.layout().imageSlots();
        assertThat(slots).hasSize(3);
        assertThat(slots.get(1).x()).isGreaterThan(slots.get(0).x());
        assertThat(slots.get(1).y()).isEqualTo(slots.get(0).y());
        assertThat(slots.get(2).x()).isEqualTo(slots.get(0).x());
        assertThat(slots.get(2).y()).isGreaterThan(slots.get(0).y());
        Region area = spec.layout().imageArea();
        for (Region slot : slots) {
            assertThat(slot.x() + slot.width()).isLessThanOrEqualTo(area.x() + area.width() + 0.001);
            assertThat(slot.y() + slot.height()).isLessThanOrEqualTo(area.y() + area.height() + 0.001);
        }
    }

    @Test
    void placesAtMostFourImages() {
        List<ImageAsset> six = List.of(img(1), img(2), img(3), img(4), img(5), img(6));

        SlideSpec spec = composer.compose(2, new ScriptEntry("T", List.of(), null), six);

        assertThat(spec.images()).hasSize(4);
        assertThat(spec.layout().imageSlots()).hasSize(4);
    }

    @Test
    void truncatesOversizedBulletAtWordBoundary() {
        String longBullet = "word ".repeat(60).trim();

        SlideSpec spec = composer.compose(3, new ScriptEntry("T", List.of("short", longBullet), null), List.of());

        assertThat(spec.bullets()).hasSize(2);
        assertThat(spec.bullets().get(0)).isEqualTo("short");
        assertThat(spec.bullets().get(1)).hasSizeLessThanOrEqualTo(160).endsWith("word…");
        assertThat(spec.warnings()).containsExactly("slide 3: bullet 2 truncated to 160 characters");
    }

    @Test
    void truncateCutsInsideLongWords() {
        String truncated = SlideComposer.truncate("x".repeat(200), 10);

        assertThat(truncated).isEqualTo("xxxxxxxxx…");
    }

    @Test
    void blankTitleWithoutTopicFallsBackToSlideNumber() {
        SlideSpec spec = composer.compose(4, new ScriptEntry("  ", List.of("b"), null), List.of());

        assertThat(spec.title()).isEqualTo("Slide 4");
    }

    @Test
    void keepsNotesOutOfBullets() {
        SlideSpec spec = composer.compose(1, new ScriptEntry("T", List.of("b"), "  speak slowly "), List.of());

        assertThat(spec.notes()).isEqualTo("speak slowly");
        assertThat(spec.bullets()).containsExactly("b");
    }

    @Test
    void shrinksFontForDenseText() {
        List<String> dense = Collections.nCopies(6, "a".repeat(100));

        SlideSpec spec = composer.compose(1, new ScriptEntry("T", dense, null), List.of(img(1)));

        assertThat(spec.layout().bodyFontSize()).isEqualTo(16);
        assertThat(spec.bullets()).containsExactlyElementsOf(dense);
        assertThat(spec.warnings()).isEmpty();
    }

    @Test
    void lowersBulletLimitWhenSmallestFontStillOverflows() {
        List<String> dense = Collections.nCopies(12, "a".repeat(150));

        SlideSpec spec = composer.compose(1, new ScriptEntry("T", dense, null), List.of(img(1)));

        Region text = spec.layout().text();
        assertThat(spec.bullets()).hasSize(12).allMatch(b -> b.length() <= 112 && b.endsWith("\u2026"));
        assertThat(spec.layout().bodyFontSize()).isEqualTo(12);
        assertThat(SlideComposer.estimateHeight(spec.bullets(), text.width(), spec.layout().bodyFontSize()))
                .isLessThanOrEqualTo(text.height());
        assertThat(spec.warnings()).hasSize(12)
                .allMatch(w -> w.endsWith("truncated to 112 characters"))
                .contains("slide 1: bullet 12 truncated to 112 characters");
    }

    @Test
    void textOnlySlidesKeepMoreCharactersThanSlidesWithImages() {
        List<String> dense = Collections.nCopies(12, "a".repeat(150));

        SlideSpec textOnly = composer.compose(1, new ScriptEntry("T", dense, null), List.of());

        Region text = textOnly.layout().text();
        assertThat(SlideComposer.estimateHeight(textOnly.bullets(), text.width(), textOnly.layout().bodyFontSize()))
                .isLessThanOrEqualTo(text.height());
        assertThat(textOnly.bullets().get(0).length()).isGreaterThan(112);
    }

    @Test
    void rejectsInvalidIndex() {
        assertThatThrownBy(() -> composer.compose(0, new ScriptEntry("T", List.of(), null), List.of()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void longTitleIsShortenedAndLoggedWithoutWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger(SlideComposer.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);

        try {
            SlideSpec spec = composer.compose(2, new ScriptEntry("t".repeat(200), List.of("b"), null), List.of());

            assertThat(spec.title()).hasSize(SlideComposer.MAX_TITLE_CHARS).endsWith("\u2026");
            assertThat(spec.warnings()).isEmpty();
            assertThat(listAppender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .map(ILoggingEvent::getFormattedMessage))
                    .anyMatch(msg -> msg.contains("title shortened slide=2"));
        } finally {
            logger.detachAppender(listAppender);
            listAppender.stop();
        }
    }
}
