package org.janelia.colortransport.ot;

import org.apache.commons.lang3.StringUtils;

public enum TransportMethod {
    BLOCKWISE("blockwise"),
    HISTOGRAM("histogram"),
    HUNGARIAN("hungarian");

    private final String methodName;

    TransportMethod(String methodName) {
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * @param name method name, case insensitive
     * @throws InvalidTransportInputException if no method has the given name
     */
    public static TransportMethod fromName(String name) {
        String normalizedName = StringUtils.lowerCase(StringUtils.trim(name));
        for (TransportMethod m : values()) {
            if (m.methodName.equals(normalizedName)) {
                return m;
            }
        }
        throw new InvalidTransportInputException("Unknown method: " + name);
    }
}
