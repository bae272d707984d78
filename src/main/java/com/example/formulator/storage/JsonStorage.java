package com.example.formulator.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.example.formulator.model.*;
import java.io.*;

public class JsonStorage {
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public FoodLookupResult loadFoodDetails(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, FoodLookupResult.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse food JSON. Expect { fdcId, description, dataType, foodNutrients: [..] }", ex);
        }
    }

    public Formulation loadFormulation(InputStream in) throws IOException {
        FormulationRecord record;
        try {
            record = mapper.readValue(in, FormulationRecord.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse formulation JSON. Expect { name, quantity_mode, ingredients: [..] }", ex);
        }
        try {
            return record.toFormulation();
        } catch (IllegalArgumentException ex) {
            throw new IOException("Invalid formulation file: " + ex.getMessage(), ex);
        }
    }

    public Formulation loadFormulation(File f) throws IOException {
        if (!f.exists()) throw new FileNotFoundException("Formulation file not found: " + f);
        try (InputStream in = new FileInputStream(f)) {
            return loadFormulation(in);
        }
    }

    public void saveFormulation(Formulation formulation, OutputStream out) throws IOException {
        mapper.writeValue(out, FormulationRecord.from(formulation));
    }

    public void saveFormulation(Formulation formulation, File f) throws IOException {
        mapper.writeValue(f, FormulationRecord.from(formulation));
    }
}
