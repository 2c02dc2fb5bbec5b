package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.assembly.SlidePlan;
import com.example.demo.deckgen.catalog.PlaceholderRole;
import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.model.BulletPoint;
import com.example.demo.deckgen.model.ContentSlide;
import com.example.demo.deckgen.model.ImageSlide;
import com.example.demo.deckgen.model.SlideSpec;
import com.example.demo.deckgen.model.SlideText;
import com.example.demo.deckgen.model.TextFormatting;
import com.example.demo.deckgen.model.TextRun;
import com.example.demo.deckgen.model.TitleSlide;
import com.example.demo.deckgen.model.TwoColumnsSlide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.geom.Rectangle2D;
import java.util.List;
import java.util.Optional;

/**
 * Fills the title, body and column placeholders. Text longer than the role's
 * budget is shrunk and, past the scale floor, truncated.
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class TextBinder implements ContentBinder {
    private static final String BULLET_CHAR = "•";
    private static final double BULLET_INDENT = 18.0;
    static final Color HYPERLINK_COLOR = new Color(0, 0, 255);

    private final TextAutoFitPolicy autoFit;
    private final DeckgenProperties properties;

    @Override
    public boolean supports(SlideSpec slide) {
        return true;
    }

    @Override
    public void bind(SlideCanvas canvas, SlidePlan plan) {
        SlideSpec slide = plan.getSlide();
        DeckgenProperties.Text text = properties.getText();

        writePlain(canvas.textTarget(PlaceholderRole.TITLE), slide.getTitle(), text.getTitleBudget(), text.getDefaultTitleFontSize());

        if (slide instanceof TitleSlide) {
            String subtitle = ((TitleSlide) slide).getSubtitle();
            if (subtitle != null) {
                writePlain(canvas.textTarget(PlaceholderRole.BODY), subtitle, text.getBodyBudget(), text.getDefaultBodyFontSize());
            }
        } else if (slide instanceof ContentSlide) {
            writeBody(canvas.textTarget(PlaceholderRole.BODY), ((ContentSlide) slide).getBody(), text.getBodyBudget());
        } else if (slide instanceof ImageSlide) {
            bindImageCaption(canvas, (ImageSlide) slide, text);
        } else if (slide instanceof TwoColumnsSlide) {
            TwoColumnsSlide columns = (TwoColumnsSlide) slide;
            if (!columns.getLeft().isEmpty()) {
                writeBody(canvas.textTarget(PlaceholderRole.COLUMN_LEFT), SlideText.ofBullets(columns.getLeft()), text.getColumnBudget());
            }
            if (!columns.getRight().isEmpty()) {
                writeBody(canvas.textTarget(PlaceholderRole.COLUMN_RIGHT), SlideText.ofBullets(columns.getRight()), text.getColumnBudget());
            }
        }
    }

    private void bindImageCaption(SlideCanvas canvas, ImageSlide slide, DeckgenProperties.Text text) {
        if (slide.getBody().isEmpty()) {
            return;
        }
        Optional<Rectangle2D> region = SlideRegions.text(canvas, slide);
        if (region.isEmpty()) {
            log.debug("Layout '{}' has no text area; body of slide '{}' not rendered",
                    canvas.getLayout().getLayoutName(), slide.getTitle());
            return;
        }
        if (!canvas.exposes(PlaceholderRole.PICTURE)) {
            canvas.resize(PlaceholderRole.BODY, region.get());
        }
        writeBody(canvas.textTarget(PlaceholderRole.BODY, region.get()), slide.getBody(), text.getBodyBudget());
    }

    void writePlain(XSLFTextShape shape, String value, int budget, double defaultSize) {
        AutoFitResult fit = autoFit.plan(value.length(), budget);
        String fitted = autoFit.truncate(value, fit);
        shape.clearText();
        XSLFTextParagraph paragraph = shape.addNewTextParagraph();
        XSLFTextRun run = paragraph.addNewTextRun();
        run.setText(fitted);
        if (fit.getScale() < 1.0) {
            run.setFontSize(baseSize(run, defaultSize) * fit.getScale());
        }
    }

    void writeBody(XSLFTextShape shape, SlideText body, int budget) {
        AutoFitResult fit = autoFit.plan(body.length(), budget);
        if (fit.isTruncated()) {
            log.debug("Text of {} chars truncated to {} at scale {}", body.length(), fit.getMaxChars(), fit.getScale());
        }
        SlideText fitted = autoFit.truncate(body, fit);
        double scale = fit.getScale();
        double defaultSize = properties.getText().getDefaultBodyFontSize();
        boolean placeholder = shape.getTextType() != null;

        shape.clearText();
        if (!fitted.getRuns().isEmpty()) {
            XSLFTextParagraph paragraph = newParagraph(shape, false);
            for (TextRun run : fitted.getRuns()) {
                String[] lines = run.getText().split("\n", -1);
                for (int i = 0; i < lines.length; i++) {
                    if (i > 0) {
                        paragraph = newParagraph(shape, false);
                    }
                    if (!lines[i].isEmpty()) {
                        addRun(paragraph, lines[i], run.getFormatting(), run.getHyperlink(), scale, defaultSize);
                    }
                }
            }
        }
        List<BulletPoint> bullets = fitted.getBullets();
        for (BulletPoint bullet : bullets) {
            XSLFTextParagraph paragraph = newParagraph(shape, true);
            paragraph.setIndentLevel(bullet.getLevel());
            if (!placeholder) {
                paragraph.setBulletCharacter(BULLET_CHAR);
                paragraph.setLeftMargin(BULLET_INDENT * (bullet.getLevel() + 1));
                paragraph.setIndent(-BULLET_INDENT);
            }
            addRun(paragraph, bullet.getText(), bullet.getFormatting(), null, scale, defaultSize);
        }
    }

    private static XSLFTextParagraph newParagraph(XSLFTextShape shape, boolean bullet) {
        XSLFTextParagraph paragraph = shape.addNewTextParagraph();
        paragraph.setBullet(bullet);
        return paragraph;
    }

    private static void addRun(XSLFTextParagraph paragraph, String value, TextFormatting formatting,
                               String hyperlink, double scale, double defaultSize) {
        XSLFTextRun run = paragraph.addNewTextRun();
        run.setText(value);
        Double size = null;
        if (formatting != null) {
            run.setBold(formatting.isBold());
            run.setItalic(formatting.isItalic());
            if (formatting.getColor() != null) {
                run.setFontColor(Color.decode(formatting.getColor()));
            }
            size = formatting.getSize();
        }
        if (size != null) {
            run.setFontSize(size * scale);
        } else if (scale < 1.0) {
            run.setFontSize(baseSize(run, defaultSize) * scale);
        }
        if (hyperlink != null) {
            run.createHyperlink().setAddress(hyperlink);
            run.setUnderlined(true);
            if (formatting == null || formatting.getColor() == null) {
                run.setFontColor(HYPERLINK_COLOR);
            }
        }
    }

    /**
     * Size the run inherits from the template's text styles, if any.
     */
    private static double baseSize(XSLFTextRun run, double defaultSize) {
        Double inherited = run.getFontSize();
        return inherited == null ? defaultSize : inherited;
    }
}
