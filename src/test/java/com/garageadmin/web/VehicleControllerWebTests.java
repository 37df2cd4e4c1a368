package com.garageadmin.web;

import com.garageadmin.controller.VehicleController;
import com.garageadmin.exception.DomainPreconditionException;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.service.VehicleWorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import com.garageadmin.config.GarageProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@EnableConfigurationProperties(GarageProperties.class)
@WebMvcTest(controllers = VehicleController.class)
class VehicleControllerWebTests {

    @Autowired MockMvc mvc;

    @MockBean VehicleWorkflowService workflowService;

    @Test
    void create_withoutOwner_is400() throws Exception {
        mvc.perform(post("/api/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plate\":\"RAD 123 A\",\"contact_number\":\"0788\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Plate, owner, and contact number are required"));

        verifyNoInteractions(workflowService);
    }

    @Test
    void create_partWithoutQuantity_is400() throws Exception {
        mvc.perform(post("/api/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plate\":\"RAD 123 A\",\"owner\":\"Jean\",\"contact_number\":\"0788\"," +
                                "\"standalone_parts\":[{\"part_id\":1}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("quantity is required"));
    }

    @Test
    void create_nullServiceId_is400() throws Exception {
        mvc.perform(post("/api/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plate\":\"RAD 123 A\",\"owner\":\"Jean\",\"contact_number\":\"0788\"," +
                                "\"service_ids\":[null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("service_ids must not contain null"));

        verifyNoInteractions(workflowService);
    }

    @Test
    void update_nullPartEntry_is400() throws Exception {
        mvc.perform(put("/api/vehicles/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plate\":\"RAD 123 A\",\"owner\":\"Jean\",\"contact_number\":\"0788\"," +
                                "\"standalone_parts\":[null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("standalone_parts must not contain null"));

        verifyNoInteractions(workflowService);
    }

    @Test
    void exit_preconditionFailure_is400WithReason() throws Exception {
        when(workflowService.exit(4L))
                .thenThrow(new DomainPreconditionException("All services must be completed before exiting."));

        mvc.perform(put("/api/vehicles/4/exit"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("All services must be completed before exiting."));
    }

    @Test
    void exit_success_returnsMessage() throws Exception {
        when(workflowService.exit(4L)).thenReturn("Vehicle exited successfully.");

        mvc.perform(put("/api/vehicles/4/exit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Vehicle exited successfully."));
    }

    @Test
    void serviceStatus_requiresStatus() throws Exception {
        mvc.perform(put("/api/vehicles/4/services/2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completed_time\":\"2025-02-03T10:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("status is required"));
    }

    @Test
    void serviceStatus_passesCompletedTimeThrough() throws Exception {
        mvc.perform(put("/api/vehicles/4/services/2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\",\"completed_time\":\"2025-02-03T10:00:00\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Service status updated successfully"));

        verify(workflowService).updateServiceStatus(4L, 2L, "completed", LocalDateTime.of(2025, 2, 3, 10, 0));
    }

    @Test
    void serviceStatus_unknownRow_is404() throws Exception {
        doThrow(new NotFoundException("Service record not found"))
                .when(workflowService).updateServiceStatus(anyLong(), anyLong(), any(), any());

        mvc.perform(put("/api/vehicles/4/services/99")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Service record not found"));
    }

    @Test
    void delete_missingVehicle_is404() throws Exception {
        doThrow(new NotFoundException("Vehicle not found")).when(workflowService).delete(77L);

        mvc.perform(delete("/api/vehicles/77"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Vehicle not found"));
    }
}
