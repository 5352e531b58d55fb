package com.example.jsonapi.context;

import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.ResourceName;

/**
 * Internal channel through which a parent request hands an already-loaded resource to a
 * nested request. Never taken from client input.
 *
 * @param resource     the resource the nested request operates on
 * @param parentName   resource on whose behalf the nested request runs
 * @param parentAction action the parent was performing
 */
public record SideloadPassthrough(Object resource, ResourceName parentName, Action parentAction) {
}
