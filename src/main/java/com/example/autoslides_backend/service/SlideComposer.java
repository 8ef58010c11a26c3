package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.ImageAsset;
import com.example.autoslides_backend.model.Region;
import com.example.autoslides_backend.model.ScriptEntry;
import com.example.autoslides_backend.model.SlideLayout;
import com.example.autoslides_backend.model.SlideSpec;
import com.example.autoslides_backend.util.LayoutMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lays out one slide on a 10 x 7.5 in canvas: title band on top, bullets in the left 55%,
 * images in the right 45%. Slides without images give the whole content width to the text.
 * All measures are points.
 */
@Service
public class SlideComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlideComposer.class);

    public static final double SLIDE_WIDTH = 720;
    public static final double SLIDE_HEIGHT = 540;
    static final double MARGIN = 28.8;
    static final double CONTENT_TOP = 108;
    static final double GAP = MARGIN / 2;
    static final double TEXT_RATIO = 0.55;
    static final double IMAGE_MAX_WIDTH = 252;
    static final double IMAGE_MAX_HEIGHT = 216;
    static final double TITLE_HEIGHT = CONTENT_TOP - MARGIN - GAP;
    static final int MAX_TITLE_CHARS = 120;
    static final double[] FONT_STEPS = {18, 16, 14, 12};
    static final String ELLIPSIS = "…";

    static final Region TITLE_REGION = new Region(MARGIN, MARGIN, SLIDE_WIDTH - 2 * MARGIN, TITLE_HEIGHT);
    static final Region TEXT_WITH_IMAGES = new Region(MARGIN, CONTENT_TOP,
            SLIDE_WIDTH * TEXT_RATIO - 2 * MARGIN, SLIDE_HEIGHT - CONTENT_TOP - MARGIN);
    static final Region TEXT_ONLY = new Region(MARGIN, CONTENT_TOP,
            SLIDE_WIDTH - 2 * MARGIN, SLIDE_HEIGHT - CONTENT_TOP - MARGIN);
    static final Region IMAGE_AREA = new Region(SLIDE_WIDTH * TEXT_RATIO + MARGIN, CONTENT_TOP,
            SLIDE_WIDTH - (SLIDE_WIDTH * TEXT_RATIO + MARGIN) - MARGIN, SLIDE_HEIGHT - CONTENT_TOP - MARGIN);

    private final DeckProperties props;

    public SlideComposer(DeckProperties props) {
        this.props = props;
    }

    public SlideSpec compose(int index, ScriptEntry entry, List<ImageAsset> images) {
        if (index < 1) {
            throw new InvalidRequestException("slide index must be 1 or greater, got " + index);
        }
        if (entry == null) {
            throw new InvalidRequestException("slide " + index + " has no content");
        }
        List<String> warnings = new ArrayList<>();

        String title = entry.hasTitle() ? entry.title().trim() : "Slide " + index;
        if (title.length() > MAX_TITLE_CHARS) {
            LOGGER.warn("SlideComposer title shortened slide={} length={}", index, title.length());
            title = truncate(title, MAX_TITLE_CHARS);
        }

        List<ImageAsset> placed = images == null ? List.of() : images.stream()
                .filter(Objects::nonNull)
                .limit(Math.max(0, props.getMaxImagesPerSlide()))
                .toList();

        List<String> raw = new ArrayList<>(entry.bullets().size());
        for (String bullet : entry.bullets()) {
            raw.add(bullet.trim());
        }
        Region textRegion = placed.isEmpty() ? TEXT_ONLY : TEXT_WITH_IMAGES;
        int budget = fitBudget(raw, textRegion, Math.max(2, props.getBulletMaxChars()), index);
        List<String> bullets = new ArrayList<>(raw.size());
        for (int b = 0; b < raw.size(); b++) {
            String bullet = raw.get(b);
            if (bullet.length() > budget) {
                bullet = truncate(bullet, budget);
                warnings.add("slide " + index + ": bullet " + (b + 1) + " truncated to " + budget + " characters");
            }
            bullets.add(bullet);
        }

        SlideLayout layout = layout(placed.size(), bullets, index);
        String notes = entry.hasNotes() ? entry.notes().trim() : null;
        return new SlideSpec(index, title, bullets, notes, placed, layout, warnings);
    }

    SlideLayout layout(int imageCount, List<String> bullets, int index) {
        if (imageCount == 0) {
            double font = fitFontSize(bullets, TEXT_ONLY, index);
            return new SlideLayout(LayoutMode.TEXT_ONLY, TITLE_REGION, TEXT_ONLY, Region.EMPTY, List.of(), font);
        }
        int cols = imageCount == 1 ? 1 : 2;
        int rows = (imageCount + cols - 1) / cols;
        double slotWidth = Math.min(IMAGE_MAX_WIDTH, (IMAGE_AREA.width() - (cols - 1) * GAP) / cols);
        double slotHeight = Math.min(IMAGE_MAX_HEIGHT, (IMAGE_AREA.height() - (rows - 1) * GAP) / rows);
        List<Region> slots = new ArrayList<>(imageCount);
        for (int i = 0; i < imageCount; i++) {
            int col = i % cols;
            int row = i / cols;
            slots.add(new Region(
                    IMAGE_AREA.x() + col * (slotWidth + GAP),
                    IMAGE_AREA.y() + row * (slotHeight + GAP),
                    slotWidth,
                    slotHeight));
        }
        double font = fitFontSize(bullets, TEXT_WITH_IMAGES, index);
        return new SlideLayout(LayoutMode.TEXT_AND_IMAGES, TITLE_REGION, TEXT_WITH_IMAGES, IMAGE_AREA, slots, font);
    }

    /** Largest step whose estimated wrapped height fits the region; the smallest step otherwise. */
    double fitFontSize(List<String> bullets, Region text, int index) {
        for (double size : FONT_STEPS) {
            if (estimateHeight(bullets, text.width(), size) <= text.height()) {
                return size;
            }
        }
        double floor = FONT_STEPS[FONT_STEPS.length - 1];
        // only reachable with more one-line bullets than the region holds; the exporter autofits the body
        LOGGER.warn("SlideComposer text may overflow slide={} bullets={} fontSize={}", index, bullets.size(), floor);
        return floor;
    }

    /**
     * Per-bullet character limit, starting at {@code maxChars} and lowered until the bullets fit the region
     * at the smallest font step. Never goes below one line per bullet; bullets are never dropped.
     */
    int fitBudget(List<String> bullets, Region text, int maxChars, int index) {
        double floor = FONT_STEPS[FONT_STEPS.length - 1];
        int oneLine = Math.max(2, (int) Math.floor(text.width() / (floor * 0.5)));
        int budget = maxChars;
        while (budget > oneLine && estimateHeight(truncateAll(bullets, budget), text.width(), floor) > text.height()) {
            budget--;
        }
        if (budget < maxChars) {
            LOGGER.debug("SlideComposer bullet limit lowered slide={} from={} to={}", index, maxChars, budget);
        }
        return budget;
    }

    private static List<String> truncateAll(List<String> bullets, int max) {
        return bullets.stream().map(b -> truncate(b, max)).toList();
    }

    static double estimateHeight(List<String> bullets, double width, double fontSize) {
        if (bullets.isEmpty()) return 0;
        int charsPerLine = Math.max(1, (int) Math.floor(width / (fontSize * 0.5)));
        double lineHeight = fontSize * 1.2;
        double height = 0;
        for (String bullet : bullets) {
            int lines = Math.max(1, (bullet.length() + charsPerLine - 1) / charsPerLine);
            height += lines * lineHeight;
        }
        return height + (bullets.size() - 1) * fontSize * 0.3;
    }

    /**
     * Cuts {@code text} so that the result including the ellipsis has at most {@code max} characters,
     * backing off to the last space when that keeps at least half of the budget.
     */
    static String truncate(String text, int max) {
        if (text.length() <= max) return text;
        String cut = text.substring(0, max - 1);
        int space = cut.lastIndexOf(' ');
        if (space >= max / 2) {
            cut = cut.substring(0, space);
        }
        return cut.stripTrailing() + ELLIPSIS;
    }
}
