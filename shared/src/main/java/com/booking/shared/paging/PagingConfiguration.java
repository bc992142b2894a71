package com.booking.shared.paging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PagingProperties.class)
public class PagingConfiguration {

    @Bean
    public PageTokenCipher pageTokenCipher(ObjectMapper objectMapper, PagingProperties properties) {
        return new PageTokenCipher(objectMapper, properties.getTokenCipherKey());
    }

    @Bean
    public CursorPaginator cursorPaginator(PageTokenCipher pageTokenCipher, PagingProperties properties) {
        return new CursorPaginator(pageTokenCipher, properties.getDefaultPageSize(), properties.getMaxPageSize());
    }
}
