package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Condition {
    ConditionType type;
    String operand1;
    String operator;   // =, >, <, >=, <=, NOT =
    String operand2;
}
