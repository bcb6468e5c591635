package com.chimera.provider;

import com.chimera.config.ChimeraProperties;
import com.chimera.exception.GenerationException;
import com.chimera.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Abstract base class for chat providers with common functionality.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    protected final WebClient webClient;
    protected final ChimeraProperties.ProviderConfig config;

    protected AbstractChatProvider(WebClient webClient, ChimeraProperties properties) {
        this.webClient = webClient;
        this.config = properties.getProvider();
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public boolean isEnabled() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Normalize any stream failure to a {@link ProviderException}.
     */
    protected Throwable toProviderException(Throwable error) {
        if (error instanceof GenerationException) {
            return error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseException = (WebClientResponseException) error;
            int status = responseException.getStatusCode().value();
            String body = responseException.getResponseBodyAsString();
            log.error("Provider {} returned HTTP {}: {}", getName(), status, abbreviate(body));
            return new ProviderException(
                    "Provider " + getName() + " returned HTTP " + status, status, error);
        }
        log.error("Provider {} stream failed: {}", getName(), error.toString());
        return new ProviderException("Provider " + getName() + " call failed: " + error.getMessage(), error);
    }

    protected static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
