package com.spendmonitor.monitor.application.controller.device.mapper;

import com.spendmonitor.monitor.application.controller.device.DeviceResponse;
import com.spendmonitor.monitor.application.controller.device.PushHealthResponse;
import com.spendmonitor.monitor.domain.device.DeviceRegistration;
import com.spendmonitor.monitor.domain.device.PushHealthReport;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface DeviceResponseMapper {

    @Mapping(target = "platformEndpointArn", source = "platformEndpointRef")
    @Mapping(target = "userId", source = "ownerId")
    DeviceResponse toResponse(DeviceRegistration registration);

    List<DeviceResponse> toResponses(List<DeviceRegistration> registrations);

    @Mapping(target = "overallHealth", source = "overall")
    @Mapping(target = "activeEndpoints", source = "activeEndpointCount")
    @Mapping(target = "invalidEndpoints", source = "invalidEndpointCount")
    PushHealthResponse toResponse(PushHealthReport report);
}
