package me.golemcore.memoria.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming, linking and text helpers shared by the memory tiers.
 */
public final class MemoryNoteSupport {

    public static final String PROFILE_PREFIX = "TPN-";
    public static final String SUMMARY_PREFIX = "SN-";
    public static final String NOTE_EXTENSION = ".md";

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*(?:\\n(.*))?$", Pattern.DOTALL);
    private static final int MAX_TITLE_CHARS = 50;
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[\\\\/:*?\"<>|#^\\[\\]]");

    private static final Pattern STAMP_WITH_TIME = Pattern.compile(
            "^(?:SN-|Reflection-[^-]+-)(\\d{4})(\\d{2})(\\d{2})(\\d{2})(\\d{2})");
    private static final Pattern DASHED_DATE = Pattern.compile("(?:\\D|^)(\\d{4})[-_](\\d{2})[-_](\\d{2})(?:\\D|$)");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final Pattern COMPACT_DATE = Pattern.compile("(?:\\D|^)(\\d{4})(\\d{2})(\\d{2})");

    private MemoryNoteSupport() {
    }

    /**
     * Metadata block and body of a note. {@code frontmatter} is {@code null}
     * when the note has no metadata block.
     */
    public record NoteParts(String frontmatter, String body) {
    }

    public static NoteParts split(String content) {
        if (content == null) {
            return new NoteParts(null, "");
        }
        String normalized = content.replace("\r\n", "\n");
        Matcher matcher = FRONTMATTER_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            return new NoteParts(null, normalized);
        }
        String body = matcher.group(2) != null ? matcher.group(2) : "";
        return new NoteParts(matcher.group(1), body);
    }

    public static String sanitizeName(String name) {
        if (name == null) {
            return "";
        }
        return UNSAFE_NAME_CHARS.matcher(name.trim()).replaceAll("_");
    }

    /**
     * File-name fragment for a title: unsafe characters removed, whitespace
     * runs replaced by {@code _}, at most 50 characters.
     */
    public static String titleForFileName(String title) {
        if (title == null) {
            return "";
        }
        String cleaned = UNSAFE_NAME_CHARS.matcher(title.trim()).replaceAll("").replaceAll("\\s+", "_");
        return cleaned.length() > MAX_TITLE_CHARS ? cleaned.substring(0, MAX_TITLE_CHARS) : cleaned;
    }

    public static String profileFileName(String topic) {
        return PROFILE_PREFIX + sanitizeName(topic) + NOTE_EXTENSION;
    }

    /**
     * Normalizes {@code [[Name.md]]}, {@code [[Name]]}, {@code Name.md} and
     * {@code Name} to {@code Name}.
     */
    public static String cleanReference(String reference) {
        if (reference == null) {
            return "";
        }
        String cleaned = reference.replace("[[", "").replace("]]", "").trim();
        if (cleaned.endsWith(NOTE_EXTENSION)) {
            cleaned = cleaned.substring(0, cleaned.length() - NOTE_EXTENSION.length());
        }
        return cleaned.trim();
    }

    public static String toReference(String name) {
        return "[[" + cleanReference(name) + NOTE_EXTENSION + "]]";
    }

    public static boolean sameReference(String first, String second) {
        return cleanReference(first).equals(cleanReference(second));
    }

    /**
     * Body of a {@code ## heading} section, up to the next second-level heading.
     * Returns an empty string when the section is absent.
     */
    public static String extractSection(String body, String heading) {
        if (body == null || body.isBlank()) {
            return "";
        }
        Pattern section = Pattern.compile("^##\\s+" + Pattern.quote(heading) + "[ \\t]*$(.*?)(?=^##\\s|\\z)",
                Pattern.DOTALL | Pattern.MULTILINE);
        Matcher matcher = section.matcher(body.replace("\r\n", "\n"));
        if (!matcher.find()) {
            return "";
        }
        return matcher.group(1).trim();
    }

    /**
     * Cuts {@code text} to {@code maxChars} and appends {@code marker} when it
     * was longer.
     */
    /**
     * Fills {@code {name}} placeholders in one pass. Substituted values are
     * never scanned again; unknown placeholders are left as they are.
     */
    public static String fillTemplate(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static String truncate(String text, int maxChars, String marker) {
        if (text == null) {
            return "";
        }
        int limit = Math.max(0, maxChars);
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + (marker != null ? marker : "");
    }

    public static String singleLine(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s*\\R\\s*", " ").trim();
    }

    /**
     * Date encoded in a note name ({@code SN-yyyyMMddHHmm-…},
     * {@code yyyy-MM-dd}, {@code yyyyMMdd}), or {@code null}.
     */
    public static LocalDate dateFromName(String reference) {
        String name = cleanReference(reference);
        if (name.isEmpty()) {
            return null;
        }

        Matcher matcher = STAMP_WITH_TIME.matcher(name);
        if (matcher.find()) {
            LocalDateTime stamp = toDateTime(matcher.group(1), matcher.group(2), matcher.group(3),
                    matcher.group(4), matcher.group(5));
            if (stamp != null) {
                return stamp.toLocalDate();
            }
        }

        matcher = DASHED_DATE.matcher(name);
        if (matcher.find()) {
            LocalDate date = toDate(matcher.group(1), matcher.group(2), matcher.group(3));
            if (date != null) {
                return date;
            }
        }

        matcher = COMPACT_DATE.matcher(name);
        while (matcher.find()) {
            LocalDate date = toDate(matcher.group(1), matcher.group(2), matcher.group(3));
            if (date != null && date.getYear() >= 1970 && date.getYear() <= 2099) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate toDate(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    private static LocalDateTime toDateTime(String year, String month, String day, String hour, String minute) {
        try {
            return LocalDateTime.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day),
                    Integer.parseInt(hour), Integer.parseInt(minute));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }
}
