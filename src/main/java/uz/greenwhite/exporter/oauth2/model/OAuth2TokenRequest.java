package uz.greenwhite.exporter.oauth2.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import uz.greenwhite.exporter.oauth2.GrantType;

/**
 * Form body of a token endpoint call. Client credentials travel in the
 * Authorization header, not here.
 */
@Builder
@Data
public class OAuth2TokenRequest {
    private GrantType grantType;
    private String code;
    private String redirectUri;
    private String refreshToken;

    public MultiValueMap<String, String> toFormData() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", grantType.getValue());
        if (code != null) {
            form.add("code", code);
        }
        if (redirectUri != null) {
            form.add("redirect_uri", redirectUri);
        }
        if (refreshToken != null) {
            form.add("refresh_token", refreshToken);
        }
        return form;
    }
}
