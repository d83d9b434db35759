package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Classification {

    private String system;
    private String code;
    private String description;
}
