package com.crewlife.booking.service;

import com.crewlife.booking.config.BookingAccessProperties;
import com.crewlife.booking.util.InviteKeyFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brand registry and position-to-calendar lookup backed by {@link BookingAccessProperties}.
 */
@Component
public class PositionDirectory {

    private static final Pattern CL_CODE = Pattern.compile("CL(\\d+)", Pattern.CASE_INSENSITIVE);

    private final BookingAccessProperties properties;

    @Autowired
    public PositionDirectory(BookingAccessProperties properties) {
        this.properties = properties;
    }

    public boolean isKnownBrand(String brand) {
        String code = InviteKeyFactory.normalizeBrand(brand);
        return InviteKeyFactory.isValidBrandCode(code) && properties.getBrands().containsKey(code);
    }

    public String brandName(String brand) {
        BookingAccessProperties.Brand entry = properties.getBrands().get(InviteKeyFactory.normalizeBrand(brand));
        return entry == null || entry.getName() == null ? InviteKeyFactory.normalizeBrand(brand) : entry.getName();
    }

    /**
     * "Waiter-CL200" yields "CL200".
     */
    public Optional<String> extractClCode(String textForEmail) {
        if (textForEmail == null) {
            return Optional.empty();
        }
        Matcher matcher = CL_CODE.matcher(textForEmail);
        return matcher.find() ? Optional.of("CL" + matcher.group(1)) : Optional.empty();
    }

    /**
     * Booking calendar for a position: the brand's entry for the CL code in the text,
     * falling back to the brand default.
     */
    public Optional<String> resolveBookingUrl(String brand, String textForEmail) {
        BookingAccessProperties.Brand entry = properties.getBrands().get(InviteKeyFactory.normalizeBrand(brand));
        if (entry == null) {
            return Optional.empty();
        }
        Optional<String> byCode = extractClCode(textForEmail)
            .map(code -> entry.getPositions().get(code.toUpperCase(Locale.ROOT)));
        if (byCode.isPresent()) {
            return byCode;
        }
        return Optional.ofNullable(entry.getDefaultBookingUrl()).filter(url -> !url.isBlank());
    }
}
