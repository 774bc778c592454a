package gr.imsi.athenarc.telemetry.util;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import gr.imsi.athenarc.telemetry.domain.DateTimeUtil;

import java.time.Instant;

public class InstantConverter implements IStringConverter<Instant> {
    @Override
    public Instant convert(String value) {
        Instant instant = DateTimeUtil.parseInstant(value);
        if (instant == null) {
            throw new ParameterException("Invalid date/time: '" + value + "'. Use ISO-8601 or " + DateTimeUtil.DEFAULT_FORMAT);
        }
        return instant;
    }
}
