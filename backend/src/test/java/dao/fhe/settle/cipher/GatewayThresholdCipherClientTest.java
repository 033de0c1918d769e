package dao.fhe.settle.cipher;

import dao.fhe.settle.config.CipherProperties;
import dao.fhe.settle.exception.DecryptionUnavailableException;
import dao.fhe.settle.exception.NetworkTransientException;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.TypeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GatewayThresholdCipherClientTest {

    private static final String GATEWAY = "http://gateway.local:8545";

    private MockRestServiceServer server;
    private GatewayThresholdCipherClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        CipherProperties props = new CipherProperties();
        props.setGatewayUrl(GATEWAY + "/");
        client = new GatewayThresholdCipherClient(restTemplate, props);
    }

    @Test
    void decrypt_postsHandleAndReadsPlaintext() {
        server.expect(requestTo(GATEWAY + "/v1/decrypt"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"ctHash\":\"0xabc\",\"utype\":6,\"securityZone\":2}"))
                .andRespond(withSuccess("{\"plaintext\":\"123456789\"}", MediaType.APPLICATION_JSON));

        BigInteger plain = client.decrypt(new EncryptedValue(BigInteger.valueOf(0xabc), TypeTag.UINT128, 2, "0x"));

        assertEquals(BigInteger.valueOf(123456789), plain);
        server.verify();
    }

    @Test
    void decrypt_refusalIsUnavailable() {
        server.expect(requestTo(GATEWAY + "/v1/decrypt"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThrows(DecryptionUnavailableException.class,
                () -> client.decrypt(EncryptedValue.of(BigInteger.ONE, TypeTag.UINT128)));
    }

    @Test
    void decrypt_missingPlaintextIsUnavailable() {
        server.expect(requestTo(GATEWAY + "/v1/decrypt"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThrows(DecryptionUnavailableException.class,
                () -> client.decrypt(EncryptedValue.of(BigInteger.ONE, TypeTag.UINT128)));
    }

    @Test
    void encrypt_returnsTaggedHandle() {
        server.expect(requestTo(GATEWAY + "/v1/encrypt"))
                .andExpect(content().json("{\"value\":\"800\",\"utype\":6,\"securityZone\":0}"))
                .andRespond(withSuccess(
                        "{\"ctHash\":\"0xff01\",\"utype\":6,\"securityZone\":0,\"signature\":\"0xbeef\"}",
                        MediaType.APPLICATION_JSON));

        EncryptedValue value = client.encrypt(BigInteger.valueOf(800), TypeTag.UINT128);

        assertEquals(BigInteger.valueOf(0xff01), value.handle());
        assertEquals(TypeTag.UINT128, value.tag());
        assertEquals("0xbeef", value.proof());
    }

    @Test
    void encrypt_serverErrorIsTransient() {
        server.expect(requestTo(GATEWAY + "/v1/encrypt")).andRespond(withServerError());

        assertThrows(NetworkTransientException.class, () -> client.encrypt(BigInteger.TEN, TypeTag.UINT128));
    }
}
