package me.golemcore.memoria.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NoteLanguageTest {

    @Test
    void shouldDetectJapaneseTitle() {
        assertEquals(NoteLanguage.JAPANESE, NoteLanguage.detect("コーヒーの話", "plain text"));
    }

    @Test
    void shouldDetectJapaneseInOpeningText() {
        assertEquals(NoteLanguage.JAPANESE, NoteLanguage.detect("Chat", "ユーザーはコーヒーが好き"));
    }

    @Test
    void shouldIgnoreJapaneseBeyondDetectionWindow() {
        assertEquals(NoteLanguage.ENGLISH, NoteLanguage.detect("Chat", "a".repeat(600) + "日本語"));
    }

    @Test
    void shouldDefaultToEnglish() {
        assertEquals(NoteLanguage.ENGLISH, NoteLanguage.detect(null, null));
        assertEquals("No additional notes.", NoteLanguage.ENGLISH.getMissingOtherNotes());
    }
}
