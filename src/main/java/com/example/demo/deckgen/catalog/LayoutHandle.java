package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.model.SlideKind;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Immutable description of a template layout: which kind it serves, how to
 * find it in a working copy, and the placeholder roles it exposes in order.
 */
@Getter
@ToString
public class LayoutHandle {
    private final SlideKind kind;
    private final String layoutName;
    private final int masterIndex;
    private final List<PlaceholderSlot> slots;

    public LayoutHandle(SlideKind kind, String layoutName, int masterIndex, List<PlaceholderSlot> slots) {
        this.kind = kind;
        this.layoutName = layoutName;
        this.masterIndex = masterIndex;
        this.slots = List.copyOf(slots);
    }

    public Optional<PlaceholderSlot> slot(PlaceholderRole role) {
        return slots.stream().filter(s -> s.getRole() == role).findFirst();
    }

    public boolean exposes(PlaceholderRole role) {
        return slot(role).isPresent();
    }
}
