package org.opensearch.export;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.UnaryOperator;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.NoConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills {@link Parameter} fields from environment variables before the command line is parsed, so
 * that flags given explicitly still win.
 *
 * <p>The variable name is the prefix followed by the option's first long name in upper snake case:
 * {@code --opensearch-url} with prefix {@code EXPORT_} reads {@code EXPORT_OPENSEARCH_URL}.</p>
 */
@Slf4j
public class EnvVarParameterPuller {
    private EnvVarParameterPuller() {}

    public static <T> T injectFromEnv(T args, String prefix) {
        return injectFromEnv(args, prefix, System::getenv);
    }

    public static <T> T injectFromEnv(T args, String prefix, UnaryOperator<String> env) {
        for (Field field : args.getClass().getDeclaredFields()) {
            var parameter = field.getAnnotation(Parameter.class);
            if (parameter == null || parameter.help() || parameter.names().length == 0) {
                continue;
            }
            var variable = prefix + toEnvName(parameter.names());
            var value = env.apply(variable);
            if (value == null) {
                continue;
            }
            field.setAccessible(true);
            try {
                field.set(args, convert(field, parameter, variable, value));
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot set " + field.getName() + " from " + variable, e);
            }
            if (variable.contains("PASSWORD")) {
                log.info("Using {} from the environment", variable);
            } else {
                log.info("Using {}={} from the environment", variable, value);
            }
        }
        return args;
    }

    static String toEnvName(String[] names) {
        var name = Arrays.stream(names)
            .filter(n -> n.startsWith("--"))
            .findFirst()
            .orElse(names[0]);
        return name.replaceFirst("^-+", "")
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replace('-', '_')
            .toUpperCase(Locale.ROOT);
    }

    private static Object convert(Field field, Parameter parameter, String variable, String value) {
        try {
            if (parameter.converter() != NoConverter.class) {
                IStringConverter<?> converter = parameter.converter().getDeclaredConstructor().newInstance();
                return converter.convert(value);
            }
            var type = field.getType();
            if (type == String.class) {
                return value;
            } else if (type == int.class || type == Integer.class) {
                return Integer.parseInt(value.trim());
            } else if (type == long.class || type == Long.class) {
                return Long.parseLong(value.trim());
            } else if (type == boolean.class || type == Boolean.class) {
                return Boolean.parseBoolean(value.trim());
            }
        } catch (NumberFormatException e) {
            throw new ParameterException("Invalid value for " + variable + ": " + value, e);
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException
                 | InvocationTargetException e) {
            throw new IllegalStateException("Cannot create converter for " + field.getName(), e);
        } catch (RuntimeException e) {
            throw new ParameterException("Invalid value for " + variable + ": " + value, e);
        }
        throw new IllegalStateException("Unsupported option type " + field.getType() + " for " + variable);
    }
}
