package io.specqueue.storage;

import java.net.InetAddress;
import java.net.UnknownHostException;

public record ProcessIdentity(long pid, String hostname) {

    public static ProcessIdentity current() {
        return new ProcessIdentity(ProcessHandle.current().pid(), localHostname());
    }

    public boolean sameHost(String otherHostname) {
        return otherHostname == null || otherHostname.isBlank() || hostname.equalsIgnoreCase(otherHostname);
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
