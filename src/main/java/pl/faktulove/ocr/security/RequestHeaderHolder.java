package pl.faktulove.ocr.security;

import jakarta.enterprise.context.RequestScoped;
import lombok.Getter;
import lombok.Setter;

/**
 * Holds the owner identity resolved for the current request.
 */
@Getter
@Setter
@RequestScoped
public class RequestHeaderHolder {

    public static final String ANONYMOUS = "anonymous";

    private String username;
}
