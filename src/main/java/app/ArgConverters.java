package app;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import stages.PlacementMode;
import util.Rgb;

/** JCommander converters and validators for the CLI options. */
public final class ArgConverters {

    private ArgConverters() {
    }

    public static final class ColorConverter implements IStringConverter<Rgb> {
        @Override
        public Rgb convert(String value) {
            try {
                return Rgb.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException("Invalid --background: " + e.getMessage());
            }
        }
    }

    public static final class ModeConverter implements IStringConverter<PlacementMode> {
        @Override
        public PlacementMode convert(String value) {
            try {
                return PlacementMode.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException("Invalid --mode: " + e.getMessage());
            }
        }
    }

    /** 1..100 */
    public static final class QualityValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) {
            int q = parseInt(name, value);
            if (q < 1 || q > 100)
                throw new ParameterException(name + " must be in [1..100], got " + value);
        }
    }

    public static final class PositiveValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) {
            if (parseInt(name, value) <= 0)
                throw new ParameterException(name + " must be a positive integer, got " + value);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ParameterException(name + " must be an integer, got " + value);
        }
    }
}
