package com.avf.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatientInput {

    public static final int SEX_MALE = 1;
    public static final int SEX_FEMALE = 2;
    public static final int IJVC_YES = 1;
    public static final int IJVC_NO = 2;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private Double mlr;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("200.0")
    private Double crp;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("20.0")
    private Double triglycerides;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("50.0")
    private Double nlr;

    @NotNull
    @Min(1)
    @Max(2)
    private Integer ijvc;

    @NotNull
    @Min(1)
    @Max(2)
    private Integer sex;
}
