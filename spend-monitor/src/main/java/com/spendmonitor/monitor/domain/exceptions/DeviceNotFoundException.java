package com.spendmonitor.monitor.domain.exceptions;

public class DeviceNotFoundException extends NotFoundException {

    private DeviceNotFoundException(String message) {
        super(message);
    }

    public static DeviceNotFoundException forEndpoint(String endpointRef) {
        return new DeviceNotFoundException("No device registered for endpoint " + endpointRef);
    }
}
