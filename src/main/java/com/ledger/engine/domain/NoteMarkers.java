package com.ledger.engine.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encoding of the pieces of transaction state that live inside the free-text notes field.
 * <ul>
 *   <li>Tags: the whole notes text read as a {@code ", "} separated list.</li>
 *   <li>Destination account: a {@code Transfer to: NAME (IBAN)} segment.</li>
 *   <li>External id / internal reference: {@code External ID: x} / {@code Ref: x} segments.</li>
 *   <li>Soft delete: a {@code [DELETED by rule]} prefix.</li>
 * </ul>
 * Segments are joined with {@code " | "}.
 */
public final class NoteMarkers {

    public static final String SEGMENT_SEPARATOR = " | ";
    public static final String TAG_SEPARATOR = ", ";
    public static final String TRANSFER_PREFIX = "Transfer to: ";
    public static final String EXTERNAL_ID_PREFIX = "External ID: ";
    public static final String REFERENCE_PREFIX = "Ref: ";
    public static final String DELETED_MARKER = "[DELETED by rule]";

    private NoteMarkers() {
    }

    // ========== Tags ==========

    public static List<String> parseTags(String notes) {
        if (notes == null || notes.isBlank()) {
            return new ArrayList<>();
        }
        List<String> tags = new ArrayList<>();
        for (String part : notes.split(",")) {
            String tag = part.trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * @return the joined tag list, or null when there are no tags left
     */
    public static String joinTags(List<String> tags) {
        return tags.isEmpty() ? null : String.join(TAG_SEPARATOR, tags);
    }

    // ========== Segments ==========

    public static String appendSegment(String notes, String segment) {
        if (notes == null || notes.isEmpty()) {
            return segment;
        }
        return notes + SEGMENT_SEPARATOR + segment;
    }

    public static String transferSegment(Account account) {
        return TRANSFER_PREFIX + account.getName() + " (" + (account.getIban() != null ? account.getIban() : "") + ")";
    }

    /**
     * Replaces an existing destination segment, or appends one.
     */
    public static String withDestination(String notes, Account destination) {
        String segment = transferSegment(destination);
        if (notes == null || !notes.contains(TRANSFER_PREFIX)) {
            return appendSegment(notes, segment);
        }
        List<String> segments = new ArrayList<>(Arrays.asList(notes.split(" \\| ", -1)));
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).contains(TRANSFER_PREFIX)) {
                segments.set(i, segment);
                break;
            }
        }
        return String.join(SEGMENT_SEPARATOR, segments);
    }

    /**
     * Name of the destination account recorded in notes, or null if none.
     */
    public static String destinationName(String notes) {
        String segment = findSegment(notes, TRANSFER_PREFIX);
        if (segment == null) {
            return null;
        }
        String rest = segment.substring(segment.indexOf(TRANSFER_PREFIX) + TRANSFER_PREFIX.length());
        int paren = rest.lastIndexOf(" (");
        String name = paren >= 0 ? rest.substring(0, paren) : rest;
        return name.isBlank() ? null : name.trim();
    }

    public static String externalId(String notes) {
        return segmentValue(notes, EXTERNAL_ID_PREFIX);
    }

    public static String internalReference(String notes) {
        return segmentValue(notes, REFERENCE_PREFIX);
    }

    // ========== Soft delete ==========

    public static boolean isDeleted(String notes) {
        return notes != null && notes.startsWith(DELETED_MARKER);
    }

    public static String markDeleted(String notes) {
        if (isDeleted(notes)) {
            return notes;
        }
        if (notes == null || notes.isEmpty()) {
            return DELETED_MARKER;
        }
        return DELETED_MARKER + " " + notes;
    }

    // Last segment wins, matching append order. Tags added later are joined onto the
    // segment with TAG_SEPARATOR, so the value ends there.
    private static String segmentValue(String notes, String prefix) {
        if (notes == null || !notes.contains(prefix)) {
            return null;
        }
        String value = null;
        for (String segment : notes.split(" \\| ")) {
            int index = segment.indexOf(prefix);
            if (index >= 0) {
                String rest = segment.substring(index + prefix.length());
                int tagStart = rest.indexOf(TAG_SEPARATOR);
                value = (tagStart >= 0 ? rest.substring(0, tagStart) : rest).trim();
            }
        }
        return value;
    }

    private static String findSegment(String notes, String prefix) {
        if (notes == null || !notes.contains(prefix)) {
            return null;
        }
        for (String segment : notes.split(" \\| ")) {
            if (segment.contains(prefix)) {
                return segment;
            }
        }
        return null;
    }
}
