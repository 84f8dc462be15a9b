package com.work.relay.app.web.dto;

import javax.validation.constraints.NotBlank;

public class QuotaRequest extends AttestedRequest {

    @NotBlank(message = "address must be present")
    private String address;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
