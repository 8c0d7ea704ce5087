package com.example.sessionstore.model;

import com.example.sessionstore.validation.Address;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("hosts")
public class Host {
    @Id
    @JsonIgnore
    private String id;

    @NotBlank
    @Indexed(unique = true)
    private String name;

    private List<@Address String> sip;
    private List<@Address String> media;
}
