package com.example.procurement.assistantservice.provider;

import com.example.procurement.assistantservice.exception.GenerationException;
import com.example.procurement.assistantservice.model.SamplingConfig;

public interface GenerationProvider {

    /**
     * @throws GenerationException on quota, network or server failure
     */
    String generate(String prompt, SamplingConfig sampling);
}
