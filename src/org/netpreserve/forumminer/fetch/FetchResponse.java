package org.netpreserve.forumminer.fetch;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.forumminer.util.Url;

import java.net.http.HttpHeaders;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

/**
 * A successful response.
 *
 * @param status   HTTP status code (2xx)
 * @param url      final URL after redirects
 * @param headers  response headers
 * @param body     response body, empty for HEAD requests
 * @param checksum {@code sha256:<hex>} of the body, computed while streaming
 */
public record FetchResponse(int status, Url url, HttpHeaders headers, byte[] body, String checksum) {

    public @Nullable String header(String name) {
        return headers.firstValue(name).orElse(null);
    }

    /**
     * The media type without parameters, or null if the server didn't send one.
     */
    public @Nullable String mimeType() {
        String contentType = header("Content-Type");
        if (contentType == null) return null;
        int i = contentType.indexOf(';');
        String type = (i == -1 ? contentType : contentType.substring(0, i)).strip().toLowerCase(Locale.ROOT);
        return type.isEmpty() ? null : type;
    }

    public Charset charset() {
        String contentType = header("Content-Type");
        if (contentType != null) {
            for (String param : contentType.split(";")) {
                String[] pair = param.strip().split("=", 2);
                if (pair.length == 2 && pair[0].strip().equalsIgnoreCase("charset")) {
                    try {
                        return Charset.forName(pair[1].strip().replace("\"", ""));
                    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                        break;
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    public String text() {
        return new String(body, charset());
    }
}
