package dao.fhe.settle.service;

import dao.fhe.settle.config.ConsensusProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PeerAttestationAnnouncerTest {

    @Test
    void announce_postsToEveryPeerAndCountsDeliveries() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();
        ConsensusProperties props = new ConsensusProperties();
        props.setPeers(List.of("http://peer-a:8080/", "http://peer-b:8080"));
        PeerAttestationAnnouncer announcer = new PeerAttestationAnnouncer(restTemplate, props);

        server.expect(requestTo("http://peer-a:8080/api/consensus/attestations"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.settlementHash").value("0xhash"))
                .andExpect(jsonPath("$.operator").value("0xop"))
                .andRespond(withSuccess());
        server.expect(requestTo("http://peer-b:8080/api/consensus/attestations"))
                .andRespond(withServerError());

        int delivered = announcer.announce(new AttestationMessage("0xbatch", "0xhash", "0xop", "0xsig"));

        assertEquals(1, delivered);
        server.verify();
    }

    @Test
    void announce_withoutPeersIsNoop() {
        PeerAttestationAnnouncer announcer = new PeerAttestationAnnouncer(new RestTemplate(), new ConsensusProperties());

        assertEquals(0, announcer.announce(new AttestationMessage("0xbatch", "0xhash", "0xop", "0xsig")));
    }
}
