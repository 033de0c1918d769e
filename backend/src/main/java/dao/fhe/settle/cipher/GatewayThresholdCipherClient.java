package dao.fhe.settle.cipher;

import com.fasterxml.jackson.databind.JsonNode;
import dao.fhe.settle.config.CipherProperties;
import dao.fhe.settle.exception.DecryptionUnavailableException;
import dao.fhe.settle.exception.NetworkTransientException;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.TypeTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the threshold decryption gateway.
 *
 * <pre>
 * POST {gateway}/v1/decrypt  {"ctHash","utype","securityZone"}  -> {"plaintext": "&lt;decimal&gt;"}
 * POST {gateway}/v1/encrypt  {"value","utype","securityZone"}   -> {"ctHash","utype","securityZone","signature"}
 * </pre>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "cipher", name = "mode", havingValue = "gateway")
public class GatewayThresholdCipherClient implements ThresholdCipherService {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public GatewayThresholdCipherClient(RestTemplate restTemplate, CipherProperties props) {
        this.restTemplate = restTemplate;
        this.baseUrl = trimSlash(props.getGatewayUrl());
        log.info("Threshold cipher gateway: {}", baseUrl);
    }

    @Override
    public BigInteger decrypt(EncryptedValue value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ctHash", value.handleHex());
        body.put("utype", value.tag().code());
        body.put("securityZone", value.securityZone());
        try {
            JsonNode response = restTemplate.postForObject(baseUrl + "/v1/decrypt", jsonEntity(body), JsonNode.class);
            if (response == null || !response.hasNonNull("plaintext")) {
                throw new DecryptionUnavailableException("Gateway returned no plaintext for " + value.handleHex());
            }
            return new BigInteger(response.get("plaintext").asText());
        } catch (HttpStatusCodeException e) {
            throw new DecryptionUnavailableException(
                    "Decrypt of " + value.handleHex() + " refused: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new DecryptionUnavailableException("Decrypt of " + value.handleHex() + " failed: " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new DecryptionUnavailableException("Gateway returned a non-numeric plaintext for " + value.handleHex(), e);
        }
    }

    @Override
    public EncryptedValue encrypt(BigInteger cleartext, TypeTag tag) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("value", cleartext.toString());
        body.put("utype", tag.code());
        body.put("securityZone", 0);
        try {
            JsonNode response = restTemplate.postForObject(baseUrl + "/v1/encrypt", jsonEntity(body), JsonNode.class);
            if (response == null || !response.hasNonNull("ctHash")) {
                throw new NetworkTransientException("Gateway returned no ciphertext");
            }
            TypeTag returned = TypeTag.fromCode(response.path("utype").asInt(tag.code()));
            return new EncryptedValue(
                    Numeric.toBigInt(response.get("ctHash").asText()),
                    returned,
                    response.path("securityZone").asInt(0),
                    response.path("signature").asText("0x"));
        } catch (RestClientException e) {
            throw new NetworkTransientException("Encrypt failed: " + e.getMessage(), e);
        }
    }

    private static HttpEntity<Map<String, Object>> jsonEntity(Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private static String trimSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
