package com.example.autoslides_backend.service;

import com.example.autoslides_backend.config.DeckProperties;
import com.example.autoslides_backend.exception.CompositionException;
import com.example.autoslides_backend.exception.ConfigurationException;
import com.example.autoslides_backend.exception.ImageFetchException;
import com.example.autoslides_backend.exception.InvalidRequestException;
import com.example.autoslides_backend.model.ImageAsset;
import com.example.autoslides_backend.model.Presentation;
import com.example.autoslides_backend.model.Region;
import com.example.autoslides_backend.model.SlideLayout;
import com.example.autoslides_backend.model.SlideSpec;
import com.example.autoslides_backend.service.Interfaces.DeckStorage;
import com.example.autoslides_backend.util.Slugifier;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.sl.usermodel.ShapeType;
import org.apache.poi.sl.usermodel.TextParagraph;
import org.apache.poi.sl.usermodel.TextShape;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFRelation;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders composed slides into a .pptx with Apache POI and publishes the file through {@link DeckStorage}.
 */
@Service
public class DeckExporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeckExporter.class);
    public static final String EXTENSION = ".pptx";
    static final String IMAGE_POLICY = "Layout: text 55% left, images 45% right. "
            + "Slides without images collapse the image column and give its width to the text.";
    static final String IMAGE_UNAVAILABLE = "Image unavailable";
    private static final Color PLACEHOLDER_FILL = new Color(0xD9, 0xD9, 0xD9);
    private static final Color PLACEHOLDER_TEXT = new Color(0x59, 0x59, 0x59);

    private final DeckProperties props;
    private final DeckStorage storage;
    private final ImageFetcher imageFetcher;

    public DeckExporter(DeckProperties props, DeckStorage storage, ImageFetcher imageFetcher) {
        this.props = props;
        this.storage = storage;
        this.imageFetcher = imageFetcher;
        if (props.hasTemplatePath() && !Files.isReadable(Path.of(props.getTemplatePath()))) {
            throw new ConfigurationException("Configured slide template does not exist: " + props.getTemplatePath());
        }
    }

    public Path export(Presentation presentation) {
        return export(presentation.slides(), presentation.templateReference(), presentation.topic());
    }

    /**
     * @param templateReference optional .pptx/.potx path; the configured template or POI's default otherwise.
     * @param topic             used for the file name; the first slide title when blank.
     * @return path of the published artifact.
     */
    public Path export(List<SlideSpec> slides, String templateReference, String topic) {
        if (slides == null || slides.isEmpty()) {
            throw new InvalidRequestException("cannot export a deck without slides");
        }
        String naming = topic != null && !topic.isBlank() ? topic : slides.get(0).title();
        String baseName = Slugifier.slugify(naming);

        try (XMLSlideShow ppt = openTemplate(templateReference)) {
            Dimension page = ppt.getPageSize();
            double sx = page.getWidth() / SlideComposer.SLIDE_WIDTH;
            double sy = page.getHeight() / SlideComposer.SLIDE_HEIGHT;
            XSLFSlideLayout layout = findTitleAndContentLayout(ppt);
            for (SlideSpec spec : slides) {
                renderSlide(ppt, layout, spec, sx, sy);
            }
            ppt.getProperties().getCoreProperties().setTitle(naming);
            ppt.getProperties().getCoreProperties().setDescription(IMAGE_POLICY);

            Path published = storage.publish(baseName, EXTENSION, ppt::write);
            LOGGER.info("DeckExporter DONE file={} slides={} template={}", published.getFileName(), slides.size(),
                    templateReference != null ? templateReference : (props.hasTemplatePath() ? props.getTemplatePath() : "<default>"));
            return published;
        } catch (IOException e) {
            throw new CompositionException("Rendering deck '" + baseName + "' failed: " + e.getMessage(), e);
        }
    }

    XMLSlideShow openTemplate(String templateReference) {
        String reference = templateReference != null && !templateReference.isBlank()
                ? templateReference.trim()
                : (props.hasTemplatePath() ? props.getTemplatePath() : null);
        if (reference == null) {
            return new XMLSlideShow();
        }
        Path path = Path.of(reference);
        if (!Files.isReadable(path)) {
            throw new CompositionException("Template not readable: " + reference);
        }
        try (InputStream in = Files.newInputStream(path)) {
            OPCPackage pkg = OPCPackage.open(in);
            if (reference.toLowerCase(Locale.ROOT).endsWith(".potx")) {
                pkg.replaceContentType(XSLFRelation.PRESENTATIONML_TEMPLATE.getContentType(), XSLFRelation.MAIN.getContentType());
            }
            XMLSlideShow ppt = new XMLSlideShow(pkg);
            while (!ppt.getSlides().isEmpty()) {
                ppt.removeSlide(0);
            }
            return ppt;
        } catch (IOException | InvalidFormatException | RuntimeException e) {
            throw new CompositionException("Template could not be opened: " + reference, e);
        }
    }

    private XSLFSlideLayout findTitleAndContentLayout(XMLSlideShow ppt) {
        for (XSLFSlideMaster master : ppt.getSlideMasters()) {
            XSLFSlideLayout layout = master.getLayout(org.apache.poi.xslf.usermodel.SlideLayout.TITLE_AND_CONTENT);
            if (layout != null) {
                return layout;
            }
        }
        LOGGER.debug("Template has no title-and-content layout, using text boxes");
        return null;
    }

    private void renderSlide(XMLSlideShow ppt, XSLFSlideLayout layout, SlideSpec spec, double sx, double sy) {
        XSLFSlide slide = layout != null ? ppt.createSlide(layout) : ppt.createSlide();
        SlideLayout regions = spec.layout();

        XSLFTextShape titleShape = placeholder(slide, Placeholder.TITLE, Placeholder.CENTERED_TITLE);
        if (titleShape == null) {
            titleShape = slide.createTextBox();
        }
        titleShape.clearText();
        titleShape.setAnchor(scale(regions.title(), sx, sy));
        XSLFTextParagraph titleParagraph = titleShape.addNewTextParagraph();
        titleParagraph.setTextAlign(TextParagraph.TextAlign.LEFT);
        titleParagraph.addNewTextRun().setText(spec.title());

        XSLFTextShape body = placeholder(slide, Placeholder.BODY, Placeholder.CONTENT);
        if (spec.bullets().isEmpty()) {
            if (body != null) {
                slide.removeShape(body);
            }
        } else {
            if (body == null) {
                body = slide.createTextBox();
            }
            body.clearText();
            body.setAnchor(scale(regions.text(), sx, sy));
            body.setTextAutofit(TextShape.TextAutofit.NORMAL);
            for (String bullet : spec.bullets()) {
                XSLFTextParagraph p = body.addNewTextParagraph();
                p.setTextAlign(TextParagraph.TextAlign.LEFT);
                p.setBullet(true);
                XSLFTextRun run = p.addNewTextRun();
                run.setText(bullet);
                run.setFontSize(regions.bodyFontSize());
            }
        }

        List<Region> slots = regions.imageSlots();
        for (int i = 0; i < spec.images().size() && i < slots.size(); i++) {
            placeImage(ppt, slide, spec.images().get(i), scale(slots.get(i), sx, sy), spec.index());
        }

        String notes = notesText(spec);
        if (notes != null) {
            XSLFNotes notesSlide = ppt.getNotesSlide(slide);
            XSLFTextShape notesBody = placeholder(notesSlide.getPlaceholders(), Placeholder.BODY);
            if (notesBody != null) {
                notesBody.setText(notes);
            } else {
                LOGGER.warn("DeckExporter notes page has no body placeholder slide={}", spec.index());
            }
        }
    }

    private void placeImage(XMLSlideShow ppt, XSLFSlide slide, ImageAsset asset, Rectangle2D slot, int slideIndex) {
        byte[] bytes = readBytes(asset, slideIndex);
        PictureData.PictureType type = bytes == null ? null : pictureType(ImageFetcher.extensionFor(bytes));
        if (type == null) {
            drawUnavailable(slide, slot);
            return;
        }
        XSLFPictureData data = ppt.addPicture(bytes, type);
        XSLFPictureShape picture = slide.createPicture(data);
        picture.setAnchor(fit(data.getImageDimension(), slot));
    }

    private byte[] readBytes(ImageAsset asset, int slideIndex) {
        if (asset == null || asset.placeholder()) {
            return null;
        }
        if (asset.hasLocalCopy()) {
            try {
                return Files.readAllBytes(Path.of(asset.localReference()));
            } catch (IOException e) {
                LOGGER.warn("DeckExporter local image unreadable slide={} path={} cause={}", slideIndex, asset.localReference(), e.getMessage());
            }
        }
        if (asset.sourceUrl() == null) {
            return null;
        }
        try {
            return imageFetcher.fetchBytes(asset.sourceUrl());
        } catch (ImageFetchException e) {
            LOGGER.warn("DeckExporter image unavailable slide={} url={} cause={}", slideIndex, asset.sourceUrl(), e.getMessage());
            return null;
        }
    }

    private void drawUnavailable(XSLFSlide slide, Rectangle2D slot) {
        XSLFAutoShape box = slide.createAutoShape();
        box.setShapeType(ShapeType.RECT);
        box.setAnchor(slot);
        box.setFillColor(PLACEHOLDER_FILL);
        box.setLineWidth(0);
        XSLFTextRun run = box.setText(IMAGE_UNAVAILABLE);
        run.setFontColor(PLACEHOLDER_TEXT);
        run.setFontSize(12.0);
        box.getTextParagraphs().get(0).setTextAlign(TextParagraph.TextAlign.CENTER);
    }

    static String notesText(SlideSpec spec) {
        String credits = spec.images().stream()
                .filter(ImageAsset::hasAttribution)
                .map(ImageAsset::attribution)
                .distinct()
                .collect(Collectors.joining("\n"));
        boolean hasNotes = spec.notes() != null && !spec.notes().isBlank();
        if (!hasNotes && credits.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        if (hasNotes) {
            sb.append(spec.notes());
        }
        if (!credits.isEmpty()) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append("Image credits:\n").append(credits);
        }
        return sb.toString();
    }

    /** Largest rectangle with the image's aspect ratio, centered in the slot. */
    static Rectangle2D fit(Dimension image, Rectangle2D slot) {
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            return slot;
        }
        double scale = Math.min(slot.getWidth() / image.getWidth(), slot.getHeight() / image.getHeight());
        double w = image.getWidth() * scale;
        double h = image.getHeight() * scale;
        return new Rectangle2D.Double(slot.getX() + (slot.getWidth() - w) / 2, slot.getY() + (slot.getHeight() - h) / 2, w, h);
    }

    private static Rectangle2D scale(Region region, double sx, double sy) {
        return new Rectangle2D.Double(region.x() * sx, region.y() * sy, region.width() * sx, region.height() * sy);
    }

    private static PictureData.PictureType pictureType(String extension) {
        if (extension == null) return null;
        switch (extension) {
            case ".jpg":
                return PictureData.PictureType.JPEG;
            case ".png":
                return PictureData.PictureType.PNG;
            case ".gif":
                return PictureData.PictureType.GIF;
            case ".bmp":
                return PictureData.PictureType.BMP;
            default:
                return null;
        }
    }

    private static XSLFTextShape placeholder(XSLFSlide slide, Placeholder... types) {
        return placeholder(slide.getPlaceholders(), types);
    }

    private static XSLFTextShape placeholder(XSLFTextShape[] shapes, Placeholder... types) {
        for (XSLFTextShape shape : shapes) {
            Placeholder actual = shape.getTextType();
            for (Placeholder wanted : types) {
                if (actual == wanted) {
                    return shape;
                }
            }
        }
        return null;
    }
}
