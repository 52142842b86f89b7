package at.sv.boost.api.hass;

import at.sv.boost.api.BoostEventListener;
import at.sv.boost.api.EntityState;
import at.sv.boost.api.HassAuthenticationFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class HassEventHandlerTest {

    private BoostEventListener boostEventListener;
    private HassAvailabilityEventListener availabilityListener;
    private HassEventHandler handler;

    @BeforeEach
    void setUp() {
        boostEventListener = Mockito.mock(BoostEventListener.class);
        availabilityListener = Mockito.mock(HassAvailabilityEventListener.class);
        handler = new HassEventHandler(boostEventListener, availabilityListener);
    }

    private void verifyNoEvents() {
        verifyNoInteractions(boostEventListener, availabilityListener);
    }

    @Test
    void onMessage_authInvalid_throws() {
        assertThatThrownBy(() -> handler.onMessage("""
                {"type": "auth_invalid", "message": "Invalid access token or password"}
                """))
                .isInstanceOf(HassAuthenticationFailure.class);

        verifyNoEvents();
    }

    @Test
    void onMessage_resultAndAuthMessages_ignored() {
        handler.onMessage("""
                {"type": "auth_ok", "ha_version": "2024.1.0"}
                """);
        handler.onMessage("""
                {"id": 2, "type": "result", "success": true, "result": null}
                """);

        verifyNoEvents();
    }

    @Test
    void onMessage_homeAssistantStarted() {
        handler.onMessage("""
                {
                  "id": 2,
                  "type": "event",
                  "event": {
                    "event_type": "homeassistant_started",
                    "data": {},
                    "origin": "LOCAL",
                    "time_fired": "2024-01-10T10:00:00.000000+00:00"
                  }
                }
                """);

        verify(availabilityListener).onStarted();
    }

    @Test
    void onMessage_stateChanged_forwardsBothStates() {
        handler.onMessage("""
                {
                  "id": 1,
                  "type": "event",
                  "event": {
                    "event_type": "state_changed",
                    "data": {
                      "entity_id": "climate.living_room",
                      "old_state": {
                        "entity_id": "climate.living_room",
                        "state": "unavailable",
                        "attributes": {}
                      },
                      "new_state": {
                        "entity_id": "climate.living_room",
                        "state": "heat",
                        "attributes": {
                          "friendly_name": "Living Room",
                          "temperature": 21.5,
                          "current_temperature": "20.1",
                          "min_temp": 7,
                          "max_temp": 30,
                          "hvac_action": "heating"
                        }
                      }
                    }
                  }
                }
                """);

        ArgumentCaptor<EntityState> oldState = ArgumentCaptor.forClass(EntityState.class);
        ArgumentCaptor<EntityState> newState = ArgumentCaptor.forClass(EntityState.class);
        verify(boostEventListener).onStateChanged(eq("climate.living_room"), oldState.capture(), newState.capture());
        assertThat(oldState.getValue().isAvailable()).isFalse();
        EntityState state = newState.getValue();
        assertThat(state.getFriendlyName()).isEqualTo("Living Room");
        assertThat(state.getTemperature()).isEqualTo(21.5);
        assertThat(state.getCurrentTemperature()).isEqualTo(20.1);
        assertThat(state.getMinTemp()).isEqualTo(7);
        assertThat(state.isHeating()).isTrue();
    }

    @Test
    void onMessage_stateChanged_entityRemoved_newStateNull() {
        handler.onMessage("""
                {
                  "type": "event",
                  "event": {
                    "event_type": "state_changed",
                    "data": {
                      "entity_id": "switch.schedule_a",
                      "old_state": {"entity_id": "switch.schedule_a", "state": "on", "attributes": {"tags": "Living Room"}},
                      "new_state": null
                    }
                  }
                }
                """);

        ArgumentCaptor<EntityState> oldState = ArgumentCaptor.forClass(EntityState.class);
        verify(boostEventListener).onStateChanged(eq("switch.schedule_a"), oldState.capture(), isNull());
        assertThat(oldState.getValue().getTags()).containsExactly("Living Room");
    }

    @Test
    void onMessage_boostStart_singleDevice() {
        handler.onMessage("""
                {
                  "type": "event",
                  "event": {
                    "event_type": "thermostat_boost_start",
                    "data": {"device_id": "climate.living_room", "time": "01:30:00", "temperature": "22.5"}
                  }
                }
                """);

        verify(boostEventListener).onStartRequested(List.of("climate.living_room"), "01:30:00", 22.5);
    }

    @Test
    void onMessage_boostStart_multipleDevices_durationMap_noTemperature() {
        handler.onMessage("""
                {
                  "type": "event",
                  "event": {
                    "event_type": "thermostat_boost_start",
                    "data": {"device_id": ["climate.a", "climate.b"], "time": {"hours": 2}}
                  }
                }
                """);

        verify(boostEventListener).onStartRequested(List.of("climate.a", "climate.b"), Map.of("hours", 2), null);
    }

    @Test
    void onMessage_boostStart_invalidTemperature_throws() {
        assertThatThrownBy(() -> handler.onMessage("""
                {
                  "type": "event",
                  "event": {
                    "event_type": "thermostat_boost_start",
                    "data": {"device_id": "climate.a", "temperature": "warm"}
                  }
                }
                """)).isInstanceOf(IllegalArgumentException.class);

        verifyNoEvents();
    }

    @Test
    void onMessage_boostFinish() {
        handler.onMessage("""
                {
                  "type": "event",
                  "event": {"event_type": "thermostat_boost_finish", "data": {"device_id": ["climate.a"]}}
                }
                """);

        verify(boostEventListener).onFinishRequested(List.of("climate.a"));
    }

    @Test
    void onMessage_boostSet_onlyGivenValues() {
        handler.onMessage("""
                {
                  "type": "event",
                  "event": {
                    "event_type": "thermostat_boost_set",
                    "data": {"device_id": "climate.a", "duration_hours": 1.5, "schedule_override": "on"}
                  }
                }
                """);

        verify(boostEventListener).onSettingsChangeRequested("climate.a",
                Map.of("duration_hours", 1.5, "schedule_override", "on"));
    }

    @Test
    void onMessage_otherEvent_ignored() {
        handler.onMessage("""
                {"type": "event", "event": {"event_type": "call_service", "data": {"domain": "light"}}}
                """);

        verifyNoEvents();
    }

    @Test
    void onMessage_invalidJson_throws() {
        assertThatThrownBy(() -> handler.onMessage("{")).isInstanceOf(IllegalArgumentException.class);
    }
}
