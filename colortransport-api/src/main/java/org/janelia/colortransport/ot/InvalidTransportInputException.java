package org.janelia.colortransport.ot;

/**
 * Raised for inputs the transport engine cannot work with: empty pixel sets, images that
 * do not have the same shape, unknown transport methods or invalid solver parameters.
 */
public class InvalidTransportInputException extends IllegalArgumentException {

    public InvalidTransportInputException(String message) {
        super(message);
    }
}
