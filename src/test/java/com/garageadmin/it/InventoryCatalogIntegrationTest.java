package com.garageadmin.it;

import com.garageadmin.model.Worker;
import com.garageadmin.repository.PartRepository;
import com.garageadmin.repository.RepairServiceRepository;
import com.garageadmin.repository.WorkerRepository;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class InventoryCatalogIntegrationTest {

    @Autowired MockMvc mvc;

    @Autowired PartRepository partRepo;
    @Autowired RepairServiceRepository serviceRepo;
    @Autowired WorkerRepository workerRepo;

    @BeforeEach
    void setUp() {
        partRepo.deleteAll();
        serviceRepo.deleteAll();
        workerRepo.deleteAll();
    }

    private long idOf(MvcResult res) throws Exception {
        Number id = JsonPath.read(res.getResponse().getContentAsString(), "$.id");
        return id.longValue();
    }

    @Test
    void partsCrud() throws Exception {
        MvcResult created = mvc.perform(post("/api/parts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Wiper blade\",\"part_number\":\"WB-2\",\"purchasing_cost\":1500,\"selling_cost\":2500}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.quantity_in_stock").value(0))
                .andReturn();
        long id = idOf(created);

        mvc.perform(post("/api/parts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Air filter\",\"part_number\":\"AF-1\",\"purchasing_cost\":900,\"selling_cost\":1400,\"quantity_in_stock\":3}"))
                .andExpect(status().isCreated());

        mvc.perform(get("/api/parts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("Air filter"));

        mvc.perform(put("/api/parts/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Wiper blade\",\"part_number\":\"WB-2\",\"purchasing_cost\":1500,\"selling_cost\":2700,\"quantity_in_stock\":12}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity_in_stock").value(12));

        mvc.perform(put("/api/parts/999999")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"x\",\"part_number\":\"x\",\"purchasing_cost\":1,\"selling_cost\":1}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Part not found"));

        mvc.perform(delete("/api/parts/" + id)).andExpect(status().isNoContent());
        mvc.perform(delete("/api/parts/" + id)).andExpect(status().isNotFound());
    }

    @Test
    void part_requiresPrices() throws Exception {
        mvc.perform(post("/api/parts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Wiper blade\",\"part_number\":\"WB-2\",\"purchasing_cost\":1500}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("selling_cost is required"));
    }

    @Test
    void services_createAssignAndList() throws Exception {
        Worker w = new Worker();
        w.setName("Eric");
        w = workerRepo.save(w);

        MvcResult created = mvc.perform(post("/api/services")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Wheel Alignment\",\"category\":\"Maintenance\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.worker_id").value(nullValue()))
                .andReturn();
        long id = idOf(created);

        mvc.perform(put("/api/services/" + id + "/assign-worker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("worker_id is required"));

        mvc.perform(put("/api/services/" + id + "/assign-worker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"worker_id\":999999}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Worker not found"));

        mvc.perform(put("/api/services/999999/assign-worker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"worker_id\":" + w.getId() + "}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Service not found"));

        mvc.perform(put("/api/services/" + id + "/assign-worker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"worker_id\":" + w.getId() + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.worker_id").value(w.getId().intValue()))
                .andExpect(jsonPath("$.worker_name").value("Eric"));

        mvc.perform(get("/api/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].worker_name").value("Eric"));
    }

    @Test
    void healthz_reportsDatabaseReachable() throws Exception {
        mvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
    }
}
