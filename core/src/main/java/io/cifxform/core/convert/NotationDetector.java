package io.cifxform.core.convert;

import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.Notation;
import java.util.Optional;

/**
 * Decides which notation a document or block uses. An explicit version marker wins; otherwise
 * the share of dot-spelled data names decides.
 */
public final class NotationDetector {

    static final double MODERN_THRESHOLD = 0.7;
    static final double LEGACY_THRESHOLD = 0.3;

    public CifVersion detect(Document document) {
        Optional<Entry.Comment> marker = document.versionMarker();
        if (marker.isPresent()) {
            String version = marker.get().declaredVersion();
            if (version.startsWith("2")) {
                return CifVersion.MODERN;
            }
            if (version.startsWith("1")) {
                return CifVersion.LEGACY;
            }
        }
        int total = 0;
        int modern = 0;
        for (Block block : document.blocks()) {
            for (String name : block.dataNames()) {
                total++;
                if (Notation.of(name) == Notation.MODERN) {
                    modern++;
                }
            }
        }
        if (total == 0) {
            return CifVersion.UNKNOWN;
        }
        double ratio = (double) modern / total;
        if (ratio >= MODERN_THRESHOLD) {
            return CifVersion.MODERN;
        }
        if (ratio <= LEGACY_THRESHOLD) {
            return CifVersion.LEGACY;
        }
        return CifVersion.MIXED;
    }

    /** Majority notation of the block's fields and loop columns; a tie counts as modern. */
    public Notation dominantNotation(Block block) {
        int modern = 0;
        int legacy = 0;
        for (String name : block.dataNames()) {
            if (Notation.of(name) == Notation.MODERN) {
                modern++;
            } else {
                legacy++;
            }
        }
        return legacy > modern ? Notation.LEGACY : Notation.MODERN;
    }
}
