package com.crewlife.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for signed links, codes, access tokens and the brand registry.
 * Loaded once at startup and injected into the services that need them.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "booking")
public class BookingAccessProperties {

    private Link link = new Link();
    private Otp otp = new Otp();
    private Token token = new Token();
    private Urls urls = new Urls();
    private Signing signing = new Signing();
    private Admin admin = new Admin();
    private Map<String, Brand> brands = defaultBrands();

    public Duration getLinkMaxAge() {
        return link.getMaxAge();
    }

    public Duration getOtpExpiry() {
        return otp.getExpiry();
    }

    /**
     * Token lifetime for {@code brandCode}, using the brand override when present.
     */
    public Duration getTokenExpiry(String brandCode) {
        Brand brand = brandCode == null ? null : brands.get(brandCode);
        if (brand != null && brand.getTokenExpiry() != null) {
            return brand.getTokenExpiry();
        }
        return token.getExpiry();
    }

    private static Map<String, Brand> defaultBrands() {
        Map<String, Brand> brands = new LinkedHashMap<>();
        brands.put("ROYAL", new Brand("Royal Caribbean"));
        brands.put("COSTA", new Brand("Costa Cruises"));
        brands.put("SEACHEFS", new Brand("Seachefs"));
        brands.put("CPD", new Brand("CPD"));
        return brands;
    }

    @Getter
    @Setter
    public static class Link {
        private Duration maxAge = Duration.ofDays(7);
        private Duration clockSkew = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Otp {
        private Duration expiry = Duration.ofMinutes(10);
        private int length = 6;
        private int maxAttempts = 3;
    }

    @Getter
    @Setter
    public static class Token {
        private Duration expiry = Duration.ofHours(48);
        private Duration consumeLockTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Urls {
        /** Page that receives signed request links. */
        private String requestBaseUrl = "http://localhost:8080/invite";
        /** Page that receives access tokens. */
        private String accessBaseUrl = "http://localhost:8080/access";
    }

    @Getter
    @Setter
    public static class Signing {
        /** Explicit secret; takes precedence over Parameter Store. */
        private String secret;
        private String secretParameter = "/booking-access/signing-secret";
    }

    @Getter
    @Setter
    public static class Admin {
        private String apiKey;
        private String apiKeyParameter = "/booking-access/admin-api-key";
    }

    @Getter
    @Setter
    public static class Brand {
        private String name;
        private Duration tokenExpiry;
        private String defaultBookingUrl;
        /** CL code (e.g. CL200) to booking calendar URL. */
        private Map<String, String> positions = new LinkedHashMap<>();

        public Brand() {
        }

        public Brand(String name) {
            this.name = name;
        }
    }
}
