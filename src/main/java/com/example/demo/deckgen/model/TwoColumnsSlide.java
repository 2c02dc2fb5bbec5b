package com.example.demo.deckgen.model;

import com.example.demo.deckgen.exception.SchemaValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class TwoColumnsSlide extends SlideSpec {
    private final List<BulletPoint> left;
    private final List<BulletPoint> right;

    @Builder
    public TwoColumnsSlide(String title, List<BulletPoint> left, List<BulletPoint> right) {
        super(SlideKind.TWO_COLUMNS, title);
        this.left = left == null ? List.of() : List.copyOf(left);
        this.right = right == null ? List.of() : List.copyOf(right);
        if (this.left.isEmpty() && this.right.isEmpty()) {
            throw new SchemaValidationException("Two-column slide '" + title + "' requires at least one bullet");
        }
    }
}
