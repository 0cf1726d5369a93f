package com.wordhmm.server.ai.emission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed, ordered set of phone classes shared by the acoustic classifier and all
 * word models. The position of a phone is its column in every emission row.
 */
public class PhoneInventory {
    private final List<String> phones;
    private final Map<String, Integer> indexByPhone;

    public PhoneInventory(List<String> phones) {
        if (phones == null || phones.isEmpty()) {
            throw new IllegalArgumentException("Phone inventory must not be empty");
        }
        this.phones = Collections.unmodifiableList(new ArrayList<>(phones));
        this.indexByPhone = new HashMap<>();
        for (int i = 0; i < phones.size(); i++) {
            if (indexByPhone.put(phones.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate phone in inventory: " + phones.get(i));
            }
        }
    }

    public int size() {
        return phones.size();
    }

    public int indexOf(String phone) {
        Integer idx = indexByPhone.get(phone);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown phone: " + phone);
        }
        return idx;
    }

    public int[] indicesOf(List<String> phoneSequence) {
        int[] indices = new int[phoneSequence.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = indexOf(phoneSequence.get(i));
        }
        return indices;
    }

    public String phoneAt(int index) {
        return phones.get(index);
    }

    public List<String> getPhones() {
        return phones;
    }
}
