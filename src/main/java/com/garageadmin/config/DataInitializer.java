package com.garageadmin.config;

import com.garageadmin.model.RepairService;
import com.garageadmin.repository.RepairServiceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

@Configuration
@Slf4j
public class DataInitializer {

    @Bean
    @ConditionalOnProperty(name = "garage.catalog.seed", havingValue = "true", matchIfMissing = true)
    CommandLineRunner seedServiceCatalog(RepairServiceRepository serviceRepository) {
        return args -> {
            // only a fresh database gets the default job types
            if (serviceRepository.count() > 0) {
                return;
            }
            List<RepairService> defaults = Arrays.asList(
                    service("Oil Change", "Maintenance"),
                    service("Tire Rotation", "Maintenance"),
                    service("Wheel Alignment", "Maintenance"),
                    service("Brake Repair", "Brakes"),
                    service("Battery Replacement", "Electrical"),
                    service("Engine Diagnostics", "Engine"),
                    service("Transmission Service", "Drivetrain"),
                    service("Air Conditioning Repair", "Climate"),
                    service("Suspension Repair", "Suspension"),
                    service("Body Work", "Body")
            );
            serviceRepository.saveAll(defaults);
            log.info("Seeded {} default services", defaults.size());
        };
    }

    private static RepairService service(String name, String category) {
        RepairService s = new RepairService();
        s.setName(name);
        s.setCategory(category);
        return s;
    }
}
