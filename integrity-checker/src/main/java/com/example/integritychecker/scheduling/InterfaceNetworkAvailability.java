package com.example.integritychecker.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;

/**
 * Treats the host as connected when at least one non-loopback interface is up.
 */
@Component
public class InterfaceNetworkAvailability implements NetworkAvailability {

    private static final Logger logger = LoggerFactory.getLogger(InterfaceNetworkAvailability.class);

    @Override
    public boolean isAvailable() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface networkInterface = interfaces.nextElement();
                if (networkInterface.isUp() && !networkInterface.isLoopback()) {
                    return true;
                }
            }
            return false;
        } catch (SocketException e) {
            logger.warn("Could not enumerate network interfaces: {}", e.getMessage());
            return false;
        }
    }
}
