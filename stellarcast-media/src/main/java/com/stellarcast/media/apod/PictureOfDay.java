package com.stellarcast.media.apod;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One APOD record as returned by the remote API. Fields the model does not
 * name are kept in {@link #otherFields()} so the cached document stays faithful
 * to the raw response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PictureOfDay {

    public static final String MEDIA_IMAGE = "image";
    public static final String MEDIA_VIDEO = "video";

    private String title;
    private String explanation;
    private String date;
    @JsonProperty("media_type")
    private String mediaType;
    private String url;
    private String hdurl;
    private String copyright;

    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> other = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> otherFields() {
        return other;
    }

    @JsonAnySetter
    public void putOther(String key, Object value) {
        other.put(key, value);
    }

    /**
     * Whether this entry can be delivered as a picture.
     */
    @JsonIgnore
    public boolean isDeliverableImage() {
        return MEDIA_IMAGE.equals(mediaType) && url != null && !url.isBlank();
    }

    /**
     * URL for the "original" attachment: the HD variant when requested and
     * available.
     */
    public String originalUrl(boolean preferHd) {
        if (preferHd && hdurl != null && !hdurl.isBlank()) {
            return hdurl;
        }
        return url;
    }
}
