package com.garageadmin.pdf;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Number and date formatting shared by the PDF documents. */
public final class MoneyFormat {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private MoneyFormat() {
    }

    /** {@code RWF 15,000}: US grouping, no minor unit. */
    public static String rwf(BigDecimal amount) {
        return format("RWF #,##0", amount);
    }

    /** {@code 12,345.50}: two fraction digits. */
    public static String amount(BigDecimal amount) {
        return format("#,##0.00", amount);
    }

    public static String dateTime(LocalDateTime value) {
        return value == null ? "-" : DATE_TIME.format(value);
    }

    // DecimalFormat is not thread-safe, so one per call
    private static String format(String pattern, BigDecimal amount) {
        DecimalFormat df = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US));
        df.setRoundingMode(RoundingMode.HALF_UP);
        return df.format(amount == null ? BigDecimal.ZERO : amount);
    }
}
