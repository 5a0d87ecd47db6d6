package com.legacy.cobol.docs.dto.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * OCCURS clause value: a literal count when the clause is numeric, otherwise the symbol
 * as written (for example a data name or {@code 1 TO 10 DEPENDING ON ...} prefix).
 */
@Value
public class Occurs {
    Integer count;
    String symbol;

    public static Occurs of(String raw) {
        try {
            return new Occurs(Integer.parseInt(raw), null);
        } catch (NumberFormatException e) {
            return new Occurs(null, raw);
        }
    }

    @JsonIgnore
    public boolean isNumeric() {
        return count != null;
    }
}
