package com.booking.shared.paging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "booking.paging")
public class PagingProperties {

    /**
     * Secret the page-token sealing key is derived from. Base64 encoded, at least 16 bytes.
     */
    private String tokenCipherKey;

    private int defaultPageSize = 20;

    private int maxPageSize = 100;
}
