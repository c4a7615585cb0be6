package stableui.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.config.EngineConfig;
import stableui.model.BoundingBox;
import stableui.model.InteractiveElement;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link PerceptionBackend} backed by an OpenAI-compatible vision chat endpoint.
 *
 * <p>The image is PNG-encoded, base64-embedded as a data URL next to a prompt, and
 * the model's plain-text answer is parsed line by line:
 * <ul>
 *   <li>{@code locate}: {@code x,y,confidence}, or {@code NONE}</li>
 *   <li>{@code describeRegion}: {@code TYPE|TEXT|X,Y,W,H[|CONFIDENCE]} per element</li>
 * </ul>
 * Transport and parse errors are logged and yield empty results.
 */
public class HttpPerceptionClient implements PerceptionBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpPerceptionClient.class);
    private static final MediaType JSON_MT = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Used when the model does not state a confidence for a described element. */
    static final double DEFAULT_ELEMENT_CONFIDENCE = 0.8;

    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final OkHttpClient http;

    public HttpPerceptionClient(String endpoint, String apiKey, String model, int timeoutSec) {
        this.endpoint = endpoint;
        this.apiKey   = apiKey;
        this.model    = model;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(timeoutSec, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .build();
    }

    /** Creates a client from configuration; the API key is read from the configured environment variable. */
    public static HttpPerceptionClient fromConfig(EngineConfig config) {
        String apiKey = System.getenv(config.getVisionApiKeyEnv());
        if (apiKey == null) {
            log.warn("HttpPerceptionClient: environment variable {} not set, calling endpoint without a key",
                    config.getVisionApiKeyEnv());
        }
        return new HttpPerceptionClient(config.getVisionEndpoint(), apiKey,
                config.getVisionModel(), config.getVisionTimeoutSec());
    }

    // ── PerceptionBackend ─────────────────────────────────────────────────

    @Override
    public Optional<Location> locate(BufferedImage image, String description) {
        try {
            String answer = chat(encode(image), buildLocatePrompt(description));
            Optional<Location> location = parseLocation(answer);
            log.debug("HttpPerceptionClient: locate('{}') -> {}", description, location.orElse(null));
            return location;
        } catch (IOException | RuntimeException e) {
            log.warn("HttpPerceptionClient: locate('{}') failed: {}", description, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<InteractiveElement> describeRegion(BufferedImage image) {
        try {
            String answer = chat(encode(image), buildDescribePrompt());
            List<InteractiveElement> elements = parseElements(answer);
            log.debug("HttpPerceptionClient: parsed {} elements", elements.size());
            return elements;
        } catch (IOException | RuntimeException e) {
            log.warn("HttpPerceptionClient: describeRegion failed: {}", e.getMessage());
            return List.of();
        }
    }

    // ── Transport ─────────────────────────────────────────────────────────

    private String chat(String base64Png, String prompt) throws IOException {
        ObjectNode imageUrl = MAPPER.createObjectNode();
        imageUrl.put("url", "data:image/png;base64," + base64Png);

        ObjectNode textPart = MAPPER.createObjectNode();
        textPart.put("type", "text");
        textPart.put("text", prompt);

        ObjectNode imagePart = MAPPER.createObjectNode();
        imagePart.put("type", "image_url");
        imagePart.set("image_url", imageUrl);

        ObjectNode message = MAPPER.createObjectNode();
        message.put("role", "user");
        message.set("content", MAPPER.createArrayNode().add(textPart).add(imagePart));

        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model);
        body.set("messages", MAPPER.createArrayNode().add(message));
        body.put("max_tokens", 512);
        body.put("temperature", 0.0);

        Request.Builder request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON_MT));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = http.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new IOException("Vision endpoint error: " + response.code() + " " + response.message());
            }
            JsonNode root = MAPPER.readTree(responseBody.string());
            return root.path("choices").path(0).path("message").path("content").asText("");
        }
    }

    private static String encode(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    // ── Prompts ───────────────────────────────────────────────────────────

    private static String buildLocatePrompt(String description) {
        return """
            Find the UI element described as: %s
            Answer with exactly one line: X,Y,CONFIDENCE
            where X,Y is the pixel centre of the element in this image and CONFIDENCE is between 0 and 1.
            If the element is not visible, answer NONE.
            """.formatted(description);
    }

    private static String buildDescribePrompt() {
        return """
            List all interactive UI elements in this screenshot, one per line:
            TYPE|TEXT|X,Y,WIDTH,HEIGHT|CONFIDENCE
            Types: button, textbox, link, combobox, checkbox, radio, tab, menuitem
            Example: button|Submit|100,200,80,36|0.9
            """;
    }

    // ── Parsing ───────────────────────────────────────────────────────────

    static Optional<Location> parseLocation(String answer) {
        if (answer == null) return Optional.empty();
        for (String line : answer.split("\\n")) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.toUpperCase(Locale.ROOT).startsWith("NONE")) return Optional.empty();
            String[] parts = line.split(",");
            if (parts.length < 2) continue;
            try {
                int x = (int) Math.round(Double.parseDouble(parts[0].trim()));
                int y = (int) Math.round(Double.parseDouble(parts[1].trim()));
                double conf = parts.length > 2 ? clamp(Double.parseDouble(parts[2].trim())) : 0.5;
                return Optional.of(new Location(x, y, conf));
            } catch (NumberFormatException e) {
                log.debug("HttpPerceptionClient: skipping unparseable line '{}'", line);
            }
        }
        return Optional.empty();
    }

    static List<InteractiveElement> parseElements(String answer) {
        List<InteractiveElement> elements = new ArrayList<>();
        if (answer == null) return elements;
        for (String line : answer.split("\\n")) {
            line = line.trim();
            if (line.isEmpty() || !line.contains("|")) continue;
            String[] parts = line.split("\\|");
            if (parts.length < 3) continue;

            String[] coords = parts[2].trim().split(",");
            if (coords.length != 4) continue;
            try {
                BoundingBox box = new BoundingBox(
                        Double.parseDouble(coords[0].trim()),
                        Double.parseDouble(coords[1].trim()),
                        Double.parseDouble(coords[2].trim()),
                        Double.parseDouble(coords[3].trim()));
                double conf = parts.length > 3
                        ? clamp(Double.parseDouble(parts[3].trim()))
                        : DEFAULT_ELEMENT_CONFIDENCE;
                elements.add(InteractiveElement.perceived("p" + elements.size(),
                        parts[0].trim().toLowerCase(Locale.ROOT), parts[1].trim(), box, conf));
            } catch (IllegalArgumentException e) {
                log.debug("HttpPerceptionClient: skipping element line '{}': {}", line, e.getMessage());
            }
        }
        return elements;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
