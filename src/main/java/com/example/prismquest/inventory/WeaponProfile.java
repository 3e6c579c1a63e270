package com.example.prismquest.inventory;

import com.example.prismquest.model.Attribute;
import com.example.prismquest.model.ItemDefinition;

/**
 * Damage, governing attribute and light affinity of the wielded weapon.
 */
public record WeaponProfile(int damage, Attribute attribute, boolean light) {

    public static final WeaponProfile UNARMED =
        new WeaponProfile(ItemDefinition.DEFAULT_WEAPON_DAMAGE, Attribute.STRENGTH, false);
}
