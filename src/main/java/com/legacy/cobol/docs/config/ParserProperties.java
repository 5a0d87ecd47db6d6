package com.legacy.cobol.docs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the line-oriented COBOL parser.
 *
 * <p>Properties are loaded from the {@code cobol.parser} namespace in application.yml:
 * <pre>
 * cobol:
 *   parser:
 *     area-b-column: 12
 *     max-source-bytes: 104857600
 * </pre>
 */
@ConfigurationProperties(prefix = "cobol.parser")
@Data
public class ParserProperties {

    /**
     * 1-based column where Area B starts. A paragraph header must begin before it;
     * anything starting at or after it is a statement.
     */
    private int areaBColumn = 12;

    /**
     * Largest source text (UTF-8 bytes) accepted for parsing.
     */
    private long maxSourceBytes = 100L * 1024 * 1024;
}
