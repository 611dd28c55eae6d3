package com.smartstream.transform.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ContentHashingService hashingService = new ContentHashingService(objectMapper);

    @Test
    void hashesWithSha256() {
        assertThat(hashingService.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(hashingService.hash(null)).isNull();
    }

    @Test
    void jsonHashIgnoresKeyOrderAtEveryLevel() throws Exception {
        String first = hashingService.hashJson(objectMapper.readTree(
                "{\"id\":1,\"address\":{\"city\":\"Oslo\",\"zip\":\"0150\"},\"tags\":[{\"k\":1,\"v\":2}]}"));
        String second = hashingService.hashJson(objectMapper.readTree(
                "{\"tags\":[{\"v\":2,\"k\":1}],\"address\":{\"zip\":\"0150\",\"city\":\"Oslo\"},\"id\":1}"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void jsonHashDistinguishesValues() throws Exception {
        assertThat(hashingService.hashJson(objectMapper.readTree("{\"id\":1}")))
                .isNotEqualTo(hashingService.hashJson(objectMapper.readTree("{\"id\":2}")));
        assertThat(hashingService.hashJson(objectMapper.readTree("{\"list\":[1,2]}")))
                .isNotEqualTo(hashingService.hashJson(objectMapper.readTree("{\"list\":[2,1]}")));
    }

    @Test
    void canonicalJsonSortsKeys() throws Exception {
        assertThat(hashingService.canonicalJson(objectMapper.readTree("{\"b\":1,\"a\":{\"d\":2,\"c\":3}}")))
                .isEqualTo("{\"a\":{\"c\":3,\"d\":2},\"b\":1}");
    }
}
