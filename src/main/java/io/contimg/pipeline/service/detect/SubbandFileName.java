package io.contimg.pipeline.service.detect;

import org.apache.commons.io.FilenameUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of a subband file name, {@code YYYY-MM-DDTHH:MM:SS_sbNN.hdf5}.
 */
public record SubbandFileName(LocalDateTime timestamp, int subbandIndex) {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final Pattern PATTERN =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2})_sb(\\d{2})\\.hdf5$");

    /**
     * @param path a file name or a full path; only the final name segment is inspected
     */
    public static Optional<SubbandFileName> parse(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(FilenameUtils.getName(path));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SubbandFileName(LocalDateTime.parse(matcher.group(1), TIMESTAMP_FORMAT),
                                                   Integer.parseInt(matcher.group(2))));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean matches(String path) {
        return path != null && PATTERN.matcher(FilenameUtils.getName(path)).matches();
    }
}
