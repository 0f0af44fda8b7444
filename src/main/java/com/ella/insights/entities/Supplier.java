package com.ella.insights.entities;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class Supplier {

    private String id;

    private String name;

    private String email;
}
