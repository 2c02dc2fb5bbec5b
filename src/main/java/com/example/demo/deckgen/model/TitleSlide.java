package com.example.demo.deckgen.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class TitleSlide extends SlideSpec {
    private final String subtitle;

    @Builder
    public TitleSlide(String title, String subtitle) {
        super(SlideKind.TITLE, title);
        this.subtitle = subtitle == null || subtitle.isBlank() ? null : subtitle;
    }
}
