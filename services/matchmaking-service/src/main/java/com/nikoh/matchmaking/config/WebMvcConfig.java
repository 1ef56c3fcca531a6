package com.nikoh.matchmaking.config;

import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.VerificationStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Locale;

/**
 * Request tracing for the verification and matching APIs, plus binding of
 * lowercase document types and statuses ({@code documentType=residence_permit}).
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final RequestLoggingInterceptor requestLoggingInterceptor;

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(requestLoggingInterceptor)
                .addPathPatterns("/api/v1/**")
                .excludePathPatterns("/actuator/**", "/swagger-ui/**", "/v3/api-docs/**");
    }

    @Override
    public void addFormatters(@NonNull FormatterRegistry registry) {
        registry.addConverter(String.class, DocumentType.class,
                value -> parseLenient(DocumentType.class, value));
        registry.addConverter(String.class, VerificationStatus.class,
                value -> parseLenient(VerificationStatus.class, value));
    }

    /**
     * Case-insensitive enum lookup; hyphens read as underscores and blank values as absent
     */
    static <E extends Enum<E>> E parseLenient(Class<E> type, String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return Enum.valueOf(type, trimmed.toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
