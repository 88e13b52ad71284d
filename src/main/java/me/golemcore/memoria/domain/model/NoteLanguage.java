package me.golemcore.memoria.domain.model;

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

import java.util.regex.Pattern;

/**
 * Language of generated memory documents, with the texts used when the model
 * leaves a field empty.
 */
public enum NoteLanguage {

    ENGLISH("English", "Unknown", "Not specified", "Overview not provided by the model.",
            "Context from this record", "User's opinion or reaction in this record.", "No additional notes."),

    JAPANESE("Japanese", "不明", "記載なし", "概要はモデルから提供されていません。",
            "この記録の文脈", "この記録でのユーザーの意見・反応。", "特記事項なし。");

    private static final Pattern JAPANESE_PATTERN = Pattern.compile("[ぁ-んァ-ヶｱ-ﾝﾞﾟ一-龠]");
    private static final int DETECTION_WINDOW = 500;

    private final String displayName;
    private final String unknownSentiment;
    private final String unspecifiedSignificance;
    private final String missingOverview;
    private final String fallbackContext;
    private final String fallbackOpinion;
    private final String missingOtherNotes;

    NoteLanguage(String displayName, String unknownSentiment, String unspecifiedSignificance,
            String missingOverview, String fallbackContext, String fallbackOpinion, String missingOtherNotes) {
        this.displayName = displayName;
        this.unknownSentiment = unknownSentiment;
        this.unspecifiedSignificance = unspecifiedSignificance;
        this.missingOverview = missingOverview;
        this.fallbackContext = fallbackContext;
        this.fallbackOpinion = fallbackOpinion;
        this.missingOtherNotes = missingOtherNotes;
    }

    /**
     * Japanese when the title or the first 500 characters of the text contain
     * kana or kanji, English otherwise.
     */
    public static NoteLanguage detect(String title, String text) {
        if (title != null && JAPANESE_PATTERN.matcher(title).find()) {
            return JAPANESE;
        }
        if (text != null) {
            String window = text.length() > DETECTION_WINDOW ? text.substring(0, DETECTION_WINDOW) : text;
            if (JAPANESE_PATTERN.matcher(window).find()) {
                return JAPANESE;
            }
        }
        return ENGLISH;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getUnknownSentiment() {
        return unknownSentiment;
    }

    public String getUnspecifiedSignificance() {
        return unspecifiedSignificance;
    }

    public String getMissingOverview() {
        return missingOverview;
    }

    public String getFallbackContext() {
        return fallbackContext;
    }

    public String getFallbackOpinion() {
        return fallbackOpinion;
    }

    public String getMissingOtherNotes() {
        return missingOtherNotes;
    }
}
