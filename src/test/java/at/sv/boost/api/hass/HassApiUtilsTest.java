package at.sv.boost.api.hass;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HassApiUtilsTest {

    @Test
    void getHassWebsocketOrigin() {
        assertThat(HassApiUtils.getHassWebsocketOrigin("http://localhost:8123")).isEqualTo("ws://localhost:8123");
        assertThat(HassApiUtils.getHassWebsocketOrigin("https://abc.ui.nabu.casa")).isEqualTo("wss://abc.ui.nabu.casa");
    }

    @Test
    void entityIdParts() {
        assertThat(HassApiUtils.getDomain("climate.living_room")).isEqualTo("climate");
        assertThat(HassApiUtils.getObjectId("climate.living_room")).isEqualTo("living_room");
        assertThat(HassApiUtils.getDomain("living_room")).isEmpty();
    }

    @Test
    void toDisplayName() {
        assertThat(HassApiUtils.toDisplayName("climate.living_room")).isEqualTo("Living Room");
        assertThat(HassApiUtils.toDisplayName("climate.bath__upstairs")).isEqualTo("Bath Upstairs");
    }
}
