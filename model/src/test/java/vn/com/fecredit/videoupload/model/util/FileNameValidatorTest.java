package vn.com.fecredit.videoupload.model.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileNameValidatorTest {

    @Test
    void testValidFileNames() {
        assertTrue(FileNameValidator.isValidFileName("holiday.mp4"));
        assertTrue(FileNameValidator.isValidFileName("my video (1).mov"));
    }

    @Test
    void testInvalidFileNames() {
        assertFalse(FileNameValidator.isValidFileName(null));
        assertFalse(FileNameValidator.isValidFileName("   "));
        assertFalse(FileNameValidator.isValidFileName("../etc/passwd"));
        assertFalse(FileNameValidator.isValidFileName("dir\\clip.mp4"));
        assertFalse(FileNameValidator.isValidFileName(".."));
    }

    @Test
    void testExtensionOf() {
        assertEquals(".mp4", FileNameValidator.extensionOf("Clip.MP4"));
        assertEquals("", FileNameValidator.extensionOf("README"));
        assertEquals("", FileNameValidator.extensionOf(".hidden"));
        assertEquals("", FileNameValidator.extensionOf("weird.m p4"));
    }

    @Test
    void testToPathSegment() {
        assertEquals("user_42", FileNameValidator.toPathSegment("user/42"));
        assertEquals("_", FileNameValidator.toPathSegment(".."));
        assertEquals("alice", FileNameValidator.toPathSegment("alice"));
    }
}
