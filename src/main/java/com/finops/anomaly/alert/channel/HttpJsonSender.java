package com.finops.anomaly.alert.channel;

import com.finops.anomaly.exception.TransportException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Posts a JSON body to a URL. Stateless apart from the shared client; anything other than a
 * 2xx response is a {@link TransportException}.
 */
public class HttpJsonSender {

    private static final Logger log = LoggerFactory.getLogger(HttpJsonSender.class);

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;

    public HttpJsonSender(OkHttpClient client) {
        this.client = client;
    }

    public int post(String url, byte[] json, Map<String, String> headers, Duration timeout)
            throws TransportException {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new TransportException("Invalid endpoint URL");
        }

        Request.Builder builder = new Request.Builder()
                .url(httpUrl)
                .post(RequestBody.create(json, JSON));
        headers.forEach(builder::header);

        OkHttpClient call = timeout != null ? client.newBuilder().callTimeout(timeout).build() : client;

        // Webhook URLs embed tokens, only the host is logged
        log.debug("POST {} bytes to {}", json.length, httpUrl.host());
        try (Response response = call.newCall(builder.build()).execute()) {
            int code = response.code();
            if (!response.isSuccessful()) {
                throw new TransportException(String.format("HTTP %d from %s: %s",
                        code, httpUrl.host(), abbreviate(bodyOf(response))));
            }
            return code;
        } catch (IOException e) {
            throw new TransportException("Request to " + httpUrl.host() + " failed: " + e.getMessage(), e);
        }
    }

    private static String bodyOf(Response response) {
        try {
            return response.body() != null ? response.body().string() : "";
        } catch (IOException e) {
            log.debug("Could not read error body: {}", e.getMessage());
            return "";
        }
    }

    private static String abbreviate(String value) {
        return value.length() > 200 ? value.substring(0, 200) + "..." : value;
    }
}
