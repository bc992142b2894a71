package com.booking.shared.outbox;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "booking.outbox")
public class OutboxProperties {

    /** Records relayed per poll. */
    private int batchSize = 50;

    /** Attempts after which a record is left for manual inspection. */
    private int maxRetries = 5;
}
