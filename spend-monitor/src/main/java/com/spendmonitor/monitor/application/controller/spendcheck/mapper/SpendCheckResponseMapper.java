package com.spendmonitor.monitor.application.controller.spendcheck.mapper;

import com.spendmonitor.monitor.application.controller.spendcheck.SpendCheckResponse;
import com.spendmonitor.monitor.domain.pipeline.PipelineRunResult;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface SpendCheckResponseMapper {

    @Mapping(target = "alertId", source = "dispatchReport.alertId")
    @Mapping(target = "delivered", source = "dispatchReport.success")
    SpendCheckResponse toResponse(PipelineRunResult result);
}
