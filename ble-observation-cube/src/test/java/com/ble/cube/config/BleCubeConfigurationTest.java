package com.ble.cube.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ble.cube.BleCubeApplication;
import com.ble.cube.dto.BleObservation;
import com.ble.cube.dto.MacAddress;
import com.ble.cube.dto.MultiDimensionalQuery;
import com.ble.cube.query.BleCube;
import com.ble.cube.service.ObservationCubeService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
        classes = BleCubeApplication.class,
        properties = {
            "ble.cube.expected-records=500",
            "ble.cube.expected-distinct-macs=20",
            "ble.cube.log-queries=true"
        })
class BleCubeConfigurationTest {

    @Autowired private CubeProperties properties;

    @Autowired private BleCube cube;

    @Autowired private ObservationCubeService service;

    @Autowired private MeterRegistry meterRegistry;

    @Test
    void contextLoads_shouldBindCubeProperties() {
        assertThat(properties.expectedRecords()).isEqualTo(500);
        assertThat(properties.expectedDistinctMacs()).isEqualTo(20);
        assertThat(properties.logQueries()).isTrue();
    }

    @Test
    void service_shouldWriteToTheSharedCube() {
        int before = cube.size();

        service.ingest(BleObservation.builder()
                .rssi((byte) -65)
                .mac(MacAddress.parse("AA:BB:CC:DD:EE:FF"))
                .timestamp(1_700_000_000L)
                .latitude(37.7749)
                .longitude(-122.4194)
                .build());

        assertThat(cube.size()).isEqualTo(before + 1);
        assertThat(service.queries()).isSameAs(cube);
        assertThat(service.query(MultiDimensionalQuery.ALL)).hasSize(before + 1);
        assertThat(meterRegistry.find("ble.cube.observations.size").gauge()).isNotNull();
    }
}
