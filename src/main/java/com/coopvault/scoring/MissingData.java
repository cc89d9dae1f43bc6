package com.coopvault.scoring;

import lombok.Value;

/**
 * Information a proposal lacks. Blocking items prevent a reliable feasibility read.
 */
@Value
public class MissingData {
    String field;
    String reason;
    boolean blocking;
}
