/**
 * Business rules: the catalogue of invariants, rule outcomes and the cross-aggregate rule service.
 */
package com.zeus.people.domain.rules;
