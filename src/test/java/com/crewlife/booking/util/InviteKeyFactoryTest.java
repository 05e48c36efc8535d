package com.crewlife.booking.util;

import com.crewlife.booking.exception.InvalidKeyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InviteKeyFactoryTest {

    private static final String HASH = EmailHashes.hash("a@x.com");

    @Nested
    @DisplayName("Key construction")
    class KeyConstructionTests {

        @Test
        void getIdentityKey_ValidParts_JoinsWithPrefix() {
            String key = InviteKeyFactory.getIdentityKey("ROYAL", HASH, "waiter-cl200");

            assertEquals("IDENTITY#ROYAL#" + HASH + "#waiter-cl200", key);
        }

        @Test
        void getIdentityKey_TextContainingDelimiter_KeepsTextLast() {
            String key = InviteKeyFactory.getIdentityKey("ROYAL", HASH, "chef#2");

            assertTrue(key.endsWith("#" + HASH + "#chef#2"));
        }

        @Test
        void getCandidateKey_ValidParts_JoinsWithPrefix() {
            assertEquals("CANDIDATE#COSTA#" + HASH, InviteKeyFactory.getCandidateKey("COSTA", HASH));
        }

        @Test
        void getIdentityKey_LowercaseBrand_Throws() {
            assertThrows(InvalidKeyException.class,
                () -> InviteKeyFactory.getIdentityKey("royal", HASH, "waiter"));
        }

        @Test
        void getCandidateKey_PlainEmailInsteadOfHash_Throws() {
            assertThrows(InvalidKeyException.class,
                () -> InviteKeyFactory.getCandidateKey("ROYAL", "a@x.com"));
        }

        @Test
        void getIdentityKey_EmptyText_Throws() {
            assertThrows(InvalidKeyException.class,
                () -> InviteKeyFactory.getIdentityKey("ROYAL", HASH, ""));
        }
    }

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        void normalizeBrand_TrimsAndUppercases() {
            assertEquals("SEACHEFS", InviteKeyFactory.normalizeBrand("  seachefs "));
        }

        @Test
        void normalizeEmail_TrimsAndLowercases() {
            assertEquals("a@x.com", InviteKeyFactory.normalizeEmail(" A@X.com "));
        }

        @Test
        void normalizeText_TrimsAndLowercases() {
            assertEquals("waiter-cl200", InviteKeyFactory.normalizeText(" Waiter-CL200 "));
        }

        @Test
        void normalize_Null_ReturnsNull() {
            assertNull(InviteKeyFactory.normalizeBrand(null));
            assertNull(InviteKeyFactory.normalizeEmail(null));
            assertNull(InviteKeyFactory.normalizeText(null));
        }

        @Test
        void isValidBrandCode_RejectsSingleLetterAndSymbols() {
            assertTrue(InviteKeyFactory.isValidBrandCode("CPD"));
            assertFalse(InviteKeyFactory.isValidBrandCode("C"));
            assertFalse(InviteKeyFactory.isValidBrandCode("ROY AL"));
            assertFalse(InviteKeyFactory.isValidBrandCode(null));
        }
    }
}
