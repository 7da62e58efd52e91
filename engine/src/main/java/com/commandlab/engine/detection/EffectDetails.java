package com.commandlab.engine.detection;

import java.util.Map;

/**
 * Type-specific evidence attached to a {@link SideEffect}. Unused fields
 * are null.
 */
public record EffectDetails(
        Change<Long>        fileSizes,
        Change<String>      contentHashes,
        Change<Integer>     lineChanges,
        Change<Object>      settingChange,
        ViewState           viewState,
        Map<String, Object> metadata) {

    public static final EffectDetails NONE = new EffectDetails(null, null, null, null, null, null);

    public record ViewState(boolean visible, boolean active) {}

    public static EffectDetails fileChange(Change<Long> sizes, Change<String> hashes, Change<Integer> lines) {
        return new EffectDetails(sizes, hashes, lines, null, null, null);
    }

    public static EffectDetails setting(Object before, Object after) {
        return new EffectDetails(null, null, null, new Change<>(before, after), null, null);
    }

    public static EffectDetails activeView() {
        return new EffectDetails(null, null, null, null, new ViewState(true, true), null);
    }

    public static EffectDetails metadata(Map<String, Object> metadata) {
        return new EffectDetails(null, null, null, null, null, Map.copyOf(metadata));
    }
}
