package com.example.handwritingcomparator.service.analysis;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.exception.ExternalServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Asks an OpenAI compatible chat completions endpoint with vision support to compare the two
 * specimens as a forensic document examiner would. Both images travel inline as Base64 data URLs.
 * The reply is kept verbatim; the {@code SIMILARITY_SCORE} line, when present, becomes the score.
 */
public class VisionChatAnalysisProvider implements AnalysisProvider {

    private static final Logger log = LoggerFactory.getLogger(VisionChatAnalysisProvider.class);

    private static final Pattern SCORE_LINE = Pattern.compile("SIMILARITY_SCORE:\\s*\\[?\\s*(\\d{1,3}(?:\\.\\d+)?)");

    static final String SYSTEM_PROMPT = """
            You are an expert forensic document examiner specializing in handwriting analysis.
            Analyze the two handwriting samples provided and compare them for authorship determination.
            Focus on: letter formations, slant consistency, spacing patterns, pressure indicators, baseline alignment,
            connecting strokes, unique characteristics, and overall writing style.
            Provide a similarity score from 0-100 and detailed analysis.""";

    static final String USER_PROMPT = """
            Compare these two handwriting samples for forensic analysis.

            The first image is the Questioned Document (sample to be verified).
            The second image is the Known Sample (reference sample).

            Provide your analysis in this exact format:
            SIMILARITY_SCORE: [0-100]
            CONFIDENCE: [LOW/MEDIUM/HIGH]
            KEY_SIMILARITIES: [list main similar features]
            KEY_DIFFERENCES: [list main different features]
            DETAILED_ANALYSIS: [comprehensive analysis paragraph]""";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ComparatorProperties.Analysis settings;

    public VisionChatAnalysisProvider(RestTemplate restTemplate,
                                      ObjectMapper objectMapper,
                                      ComparatorProperties.Analysis settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public Optional<AnalysisResult> analyze(byte[] questioned, byte[] known) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getApiKey());
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody(questioned, known), headers);

        String url = stripTrailingSlash(settings.getBaseUrl()) + "/chat/completions";
        log.debug("Requesting handwriting opinion from {} using model {}", url, settings.getModel());
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, request, String.class);
        } catch (RestClientException ex) {
            throw new ExternalServiceException("Vision model request failed: " + ex.getMessage(), ex);
        }

        String content = extractContent(response.getBody());
        Double score = parseScore(content);
        log.debug("Vision model replied with {} characters, score {}", content.length(), score);
        return Optional.of(new AnalysisResult(content, score, name()));
    }

    @Override
    public String name() {
        return "vision-chat:" + settings.getModel();
    }

    Map<String, Object> requestBody(byte[] questioned, byte[] known) {
        List<Map<String, Object>> userContent = List.of(
                Map.of("type", "text", "text", USER_PROMPT),
                imagePart(questioned),
                imagePart(known));
        return Map.of(
                "model", settings.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", userContent)));
    }

    private String extractContent(String body) {
        if (body == null || body.isBlank()) {
            throw new ExternalServiceException("Vision model returned an empty body");
        }
        try {
            JsonNode content = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new ExternalServiceException("Vision model reply carries no message content");
            }
            return content.asText();
        } catch (JsonProcessingException ex) {
            throw new ExternalServiceException("Vision model reply is not valid JSON", ex);
        }
    }

    /**
     * Reads the number following {@code SIMILARITY_SCORE:}, clamped to [0, 100].
     *
     * @return the score, or {@code null} when the line is missing or unreadable
     */
    static Double parseScore(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = SCORE_LINE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double value = Double.parseDouble(matcher.group(1));
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static Map<String, Object> imagePart(byte[] image) {
        String dataUrl = "data:" + mimeType(image) + ";base64," + Base64.getEncoder().encodeToString(image);
        return Map.of("type", "image_url", "image_url", Map.of("url", dataUrl));
    }

    static String mimeType(byte[] image) {
        if (image.length >= 3 && (image[0] & 0xFF) == 0xFF && (image[1] & 0xFF) == 0xD8 && (image[2] & 0xFF) == 0xFF) {
            return MediaType.IMAGE_JPEG_VALUE;
        }
        return MediaType.IMAGE_PNG_VALUE;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
