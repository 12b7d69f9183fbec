package com.example.cardamageanalyzer.service.scoring;

import com.example.cardamageanalyzer.config.AnalyzerProperties;
import com.example.cardamageanalyzer.exception.ScoringException;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.ItemErrorKind;
import com.example.cardamageanalyzer.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Forwards an image to the damage scoring backend as a multipart {@code file} part and reads
 * back {@code {"damagePercentage": .., "confidence": ..}}. Exactly one request is made per call.
 */
@Service
public class HttpScoringClient implements ScoringClient {

    private static final Logger log = LoggerFactory.getLogger(HttpScoringClient.class);

    static final String FILE_PART = "file";

    private final RestTemplate restTemplate;
    private final String url;

    public HttpScoringClient(RestTemplate restTemplate, AnalyzerProperties properties) {
        this.restTemplate = restTemplate;
        this.url = properties.getScoring().getUrl();
    }

    @Override
    public ScoreResult score(ImagePayload image) throws ScoringException {
        ResponseEntity<ScoringResponse> response;
        try {
            response = restTemplate.postForEntity(url, buildRequest(image), ScoringResponse.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            log.debug("Scoring service answered {} for {}", status, image.fileName());
            throw ScoringException.serviceError(status,
                    "Scoring service answered " + status + " for " + image.fileName(), ex);
        } catch (ResourceAccessException ex) {
            throw new ScoringException(ItemErrorKind.TRANSPORT_FAILURE,
                    "Scoring service unreachable for " + image.fileName() + ": " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new ScoringException(ItemErrorKind.MALFORMED_RESPONSE,
                    "Unreadable scoring response for " + image.fileName(), ex);
        }

        ScoringResponse body = response.getBody();
        if (body == null || !body.isComplete()) {
            throw new ScoringException(ItemErrorKind.MALFORMED_RESPONSE,
                    "Scoring response for " + image.fileName() + " lacks damagePercentage or confidence", null);
        }
        ScoreResult result = ScoreResult.fromRaw(body.damagePercentage(), body.confidence());
        log.debug("Scored {}: damage {}%, confidence {}%", image.fileName(),
                result.damagePercentage(), result.confidence());
        return result;
    }

    private HttpEntity<MultiValueMap<String, Object>> buildRequest(ImagePayload image) {
        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentType(partContentType(image.mediaType()));
        partHeaders.setContentDispositionFormData(FILE_PART, image.fileName());
        ByteArrayResource resource = new ByteArrayResource(image.data()) {
            @Override
            public String getFilename() {
                return image.fileName();
            }
        };

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add(FILE_PART, new HttpEntity<>(resource, partHeaders));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return new HttpEntity<>(body, headers);
    }

    private static MediaType partContentType(String mediaType) {
        try {
            return MediaType.parseMediaType(mediaType);
        } catch (InvalidMediaTypeException ex) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
