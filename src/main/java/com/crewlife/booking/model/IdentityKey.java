package com.crewlife.booking.model;

import com.crewlife.booking.util.EmailHashes;
import com.crewlife.booking.util.InviteKeyFactory;

import java.util.Objects;

/**
 * The (brand, email, position) tuple that scopes codes, tokens and reuse blocking.
 * Values are normalized on construction: brand upper case, email lower case and trimmed.
 */
public final class IdentityKey {

    private final String brand;
    private final String email;
    private final String textForEmail;
    private final String emailHash;

    private IdentityKey(String brand, String email, String textForEmail) {
        this.brand = InviteKeyFactory.normalizeBrand(brand);
        this.email = InviteKeyFactory.normalizeEmail(email);
        this.textForEmail = textForEmail.trim();
        this.emailHash = EmailHashes.hash(this.email);
    }

    public static IdentityKey of(String brand, String email, String textForEmail) {
        if (isBlank(brand) || isBlank(email) || isBlank(textForEmail)) {
            throw new IllegalArgumentException("brand, email and textForEmail are required");
        }
        return new IdentityKey(brand, email, textForEmail);
    }

    public static IdentityKey fromRecord(InviteRecord record) {
        return of(record.getBrand(), record.getEmail(), record.getTextForEmail());
    }

    public String getBrand() {
        return brand;
    }

    public String getEmail() {
        return email;
    }

    public String getTextForEmail() {
        return textForEmail;
    }

    public String getEmailHash() {
        return emailHash;
    }

    public String identityKey() {
        return InviteKeyFactory.getIdentityKey(brand, emailHash, InviteKeyFactory.normalizeText(textForEmail));
    }

    public String candidateKey() {
        return InviteKeyFactory.getCandidateKey(brand, emailHash);
    }

    /**
     * Whether {@code record} belongs to this identity. The email side matches on the
     * plaintext address or on either encoding of its hash.
     */
    public boolean matches(InviteRecord record) {
        if (record == null || !brand.equals(InviteKeyFactory.normalizeBrand(record.getBrand()))) {
            return false;
        }
        if (!InviteKeyFactory.normalizeText(textForEmail).equals(InviteKeyFactory.normalizeText(record.getTextForEmail()))) {
            return false;
        }
        String recordEmail = InviteKeyFactory.normalizeEmail(record.getEmail());
        if (recordEmail != null && !recordEmail.isEmpty()) {
            return email.equals(recordEmail);
        }
        return EmailHashes.matches(email, record.getEmailHash());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityKey that = (IdentityKey) o;
        return brand.equals(that.brand) && email.equals(that.email)
            && InviteKeyFactory.normalizeText(textForEmail).equals(InviteKeyFactory.normalizeText(that.textForEmail));
    }

    @Override
    public int hashCode() {
        return Objects.hash(brand, email, InviteKeyFactory.normalizeText(textForEmail));
    }

    @Override
    public String toString() {
        return "IdentityKey{brand=" + brand + ", emailHash=" + emailHash.substring(0, 8)
            + ", textForEmail=" + textForEmail + "}";
    }
}
