package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.model.BulletPoint;
import com.example.demo.deckgen.model.SlideText;
import com.example.demo.deckgen.model.TextRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Shrink-then-truncate fitting of text into a placeholder.
 *
 * A placeholder holding {@code budget} characters at full size holds
 * {@code budget / s²} characters at scale {@code s}. The scale steps down
 * until the text fits or the floor is reached; whatever still does not fit
 * is cut and marked with the ellipsis.
 */
@Component
@RequiredArgsConstructor
public class TextAutoFitPolicy {
    private static final double EPSILON = 1e-9;

    private final DeckgenProperties properties;

    public AutoFitResult plan(int length, int budget) {
        DeckgenProperties.Text text = properties.getText();
        double step = text.getScaleStep();
        double floor = text.getMinScale();
        double scale = 1.0;
        while (step > 0 && length > capacity(budget, scale) && scale - step >= floor - EPSILON) {
            scale = Math.round((scale - step) * 1000d) / 1000d;
        }
        int capacity = capacity(budget, scale);
        if (length <= capacity) {
            return new AutoFitResult(scale, length, false);
        }
        return new AutoFitResult(scale, capacity, true);
    }

    static int capacity(int budget, double scale) {
        return (int) Math.floor(budget / (scale * scale) + EPSILON);
    }

    public String truncate(String value, AutoFitResult fit) {
        if (!fit.isTruncated() || value.length() <= fit.getMaxChars()) {
            return value;
        }
        String ellipsis = properties.getText().getEllipsis();
        int keep = Math.max(0, fit.getMaxChars() - ellipsis.length());
        return cut(value, keep) + ellipsis;
    }

    /**
     * Prefix of at most {@code keep} chars that never ends inside a surrogate pair.
     */
    static String cut(String value, int keep) {
        if (keep <= 0) {
            return "";
        }
        if (keep >= value.length()) {
            return value;
        }
        int end = Character.isHighSurrogate(value.charAt(keep - 1)) ? keep - 1 : keep;
        return value.substring(0, end);
    }

    /**
     * Cut a text body to the planned length. Runs are consumed before bullets;
     * the item crossing the limit is cut and ends with the ellipsis, later items
     * are dropped.
     */
    public SlideText truncate(SlideText body, AutoFitResult fit) {
        if (!fit.isTruncated()) {
            return body;
        }
        String ellipsis = properties.getText().getEllipsis();
        int remaining = Math.max(0, fit.getMaxChars() - ellipsis.length());
        boolean cut = false;

        List<TextRun> runs = new ArrayList<>();
        for (TextRun run : body.getRuns()) {
            if (cut) {
                break;
            }
            if (run.getText().length() <= remaining) {
                runs.add(run);
                remaining -= run.getText().length();
            } else {
                runs.add(new TextRun(cut(run.getText(), remaining) + ellipsis, run.getFormatting(), run.getHyperlink()));
                cut = true;
            }
        }
        List<BulletPoint> bullets = new ArrayList<>();
        for (BulletPoint bullet : body.getBullets()) {
            if (cut) {
                break;
            }
            if (bullet.getText().length() <= remaining) {
                bullets.add(bullet);
                remaining -= bullet.getText().length();
            } else {
                bullets.add(new BulletPoint(cut(bullet.getText(), remaining) + ellipsis, bullet.getLevel(), bullet.getFormatting()));
                cut = true;
            }
        }
        return new SlideText(runs, bullets);
    }
}
