package com.phonediag.analyzer.aggregate;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从会话目录名解析采集时间，例如 23-Aug-25_03-20-07-44。
 * 末尾的 -44 是亚秒噪声，直接丢弃；没有这一段也接受。
 */
@Slf4j
public final class SessionTimestampParser {

    private static final Pattern DIR_NAME = Pattern.compile(
            "^(\\d{1,2}-[A-Za-z]{3}-\\d{2}_\\d{2}-\\d{2}-\\d{2})(?:-\\d{1,3})?$");

    // 两位年份按 2000-2099 解析
    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-uu_HH-mm-ss")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    private SessionTimestampParser() {
    }

    public static Optional<LocalDateTime> parse(String dirName) {
        if (dirName == null) {
            return Optional.empty();
        }
        Matcher m = DIR_NAME.matcher(dirName);
        if (!m.matches()) {
            log.warn("Could not parse timestamp from '{}': name does not match DD-Mon-YY_HH-MM-SS[-NN]", dirName);
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(m.group(1), FORMAT));
        } catch (DateTimeParseException e) {
            log.warn("Could not parse timestamp from '{}': {}", dirName, e.getMessage());
            return Optional.empty();
        }
    }
}
